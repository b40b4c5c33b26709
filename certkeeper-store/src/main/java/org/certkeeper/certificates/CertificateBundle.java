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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Stored form of the bundle format: certificate, private key and metadata in a single versioned document.
 * <p>
 * Schema changes are additive only: unknown properties are ignored so that older readers can still load
 * bundles written by newer versions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CertificateBundle {

    @JsonProperty("version")
    private int version;

    @JsonProperty("sans")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<String> sans;

    @ToString.Exclude
    @JsonProperty("certificate_pem")
    private byte[] certificatePEM;

    @ToString.Exclude
    @JsonProperty("private_key_pem")
    private byte[] privateKeyPEM;

    @ToString.Exclude
    @JsonProperty("issuer_data")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonRawValue
    @JsonDeserialize(using = RawJsonDeserializer.class)
    private String issuerData; // compact JSON text

    @JsonProperty("created_at")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Instant createdAt;

    @JsonProperty("updated_at")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Instant updatedAt;
}
