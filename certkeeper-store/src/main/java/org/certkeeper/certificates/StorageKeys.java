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

import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives the storage keys of certificate material. Keys of a resource depend only on the issuer and on the
 * (normalized) names key of the certificate:
 * <pre>
 * certificates/&lt;issuer&gt;/&lt;name&gt;/&lt;name&gt;.key    private key
 * certificates/&lt;issuer&gt;/&lt;name&gt;/&lt;name&gt;.crt    certificate chain
 * certificates/&lt;issuer&gt;/&lt;name&gt;/&lt;name&gt;.json   metadata
 * certificates/&lt;issuer&gt;/&lt;name&gt;.bundle.json     bundle
 * </pre>
 */
public final class StorageKeys {

    public static final String CERTIFICATES_PREFIX = "certificates";
    public static final String BUNDLE_SUFFIX = ".bundle.json";
    public static final String COMPROMISED_SUFFIX = ".compromised";

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^\\w@.-]");

    private StorageKeys() {
    }

    public static String certsPrefix(String issuerKey) {
        return CERTIFICATES_PREFIX + "/" + safe(issuerKey);
    }

    public static String certsSitePrefix(String issuerKey, String domain) {
        return certsPrefix(issuerKey) + "/" + safe(domain);
    }

    public static String sitePrivateKey(String issuerKey, String domain) {
        return certsSitePrefix(issuerKey, domain) + "/" + safe(domain) + ".key";
    }

    public static String siteCert(String issuerKey, String domain) {
        return certsSitePrefix(issuerKey, domain) + "/" + safe(domain) + ".crt";
    }

    public static String siteMeta(String issuerKey, String domain) {
        return certsSitePrefix(issuerKey, domain) + "/" + safe(domain) + ".json";
    }

    public static String siteBundle(String issuerKey, String domain) {
        return certsPrefix(issuerKey) + "/" + safe(domain) + BUNDLE_SUFFIX;
    }

    /**
     * @return private key, certificate and metadata keys, in write order.
     */
    public static List<String> legacyKeys(String issuerKey, String domain) {
        return List.of(sitePrivateKey(issuerKey, domain), siteCert(issuerKey, domain), siteMeta(issuerKey, domain));
    }

    /**
     * Make a string usable as a single key segment: lower case, no path separators, no traversal.
     *
     * @param str any string, e.g. a domain name or an issuer URL
     * @return a safe key segment
     */
    public static String safe(String str) {
        String result = str.toLowerCase().trim()
                .replace(" ", "_")
                .replace("+", "_plus_")
                .replace("*", "wildcard_")
                .replace(":", "-")
                .replace("..", "");
        return UNSAFE_CHARS.matcher(result).replaceAll("");
    }
}
