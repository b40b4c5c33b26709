/*
 Licensed to Diennea S.r.l. under one
 or more contributor license agreements. See the NOTICE file
 distributed with this work for additional information
 regarding copyright ownership. Diennea S.r.l. licenses this file
 to you under the Apache License, Version 2.0 (the
 "License"); you may not use this file except in compliance
 with the License.  You may obtain a copy of the License at

 http://www.apache.org/licenses/LICENSE-2.0

 Unless required by applicable law or agreed to in writing,
 software distributed under the License is distributed on an
 "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 KIND, either express or implied.  See the License for the
 specific language governing permissions and limitations
 under the License.

 */
package org.certkeeper.certificates;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Certificate material of a site: certificate chain, private key and the metadata of the issuer.
 * <p>
 * PEM blobs are opaque: they are stored and loaded byte by byte, never parsed. Issuer data is a JSON document
 * owned by the issuer, stored without whitespace but otherwise as written. The {@link #namesKey() names key}
 * identifies the storage slot of the resource: two resources with the same names key overwrite each other.
 * <p>
 * Instances are immutable, byte arrays are copied in and out.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CertificateResource {

    private static final int MAX_NAMES_KEY_LENGTH = 1024;
    private static final String TRUNCATED_SUFFIX = "_trunc";

    private final List<String> sans;
    @ToString.Exclude
    private final byte[] certificatePEM;
    @ToString.Exclude
    private final byte[] privateKeyPEM;
    @ToString.Exclude
    private final byte[] issuerData;
    @EqualsAndHashCode.Exclude
    private final String issuerKey; // derived from the storage location on load

    public CertificateResource(List<String> sans, byte[] certificatePEM, byte[] privateKeyPEM, byte[] issuerData) {
        this(sans, certificatePEM, privateKeyPEM, issuerData, null);
    }

    public CertificateResource(List<String> sans, byte[] certificatePEM, byte[] privateKeyPEM, byte[] issuerData,
                               String issuerKey) {
        this.sans = sans != null ? List.copyOf(sans) : List.of();
        this.certificatePEM = copy(certificatePEM);
        this.privateKeyPEM = copy(privateKeyPEM);
        this.issuerData = copy(issuerData);
        this.issuerKey = issuerKey;
    }

    private static byte[] copy(byte[] data) {
        return data != null ? data.clone() : new byte[0];
    }

    public byte[] getCertificatePEM() {
        return certificatePEM.clone();
    }

    public byte[] getPrivateKeyPEM() {
        return privateKeyPEM.clone();
    }

    public byte[] getIssuerData() {
        return issuerData.clone();
    }

    public CertificateResource withIssuerData(byte[] issuerData) {
        return new CertificateResource(sans, certificatePEM, privateKeyPEM, issuerData, issuerKey);
    }

    /**
     * @return the sorted SANs joined by commas, truncated to a bounded length.
     */
    public String namesKey() {
        List<String> sorted = new ArrayList<>(sans);
        Collections.sort(sorted);
        String result = String.join(",", sorted);
        if (result.length() > MAX_NAMES_KEY_LENGTH) {
            result = result.substring(0, MAX_NAMES_KEY_LENGTH - TRUNCATED_SUFFIX.length()) + TRUNCATED_SUFFIX;
        }
        return result;
    }
}
