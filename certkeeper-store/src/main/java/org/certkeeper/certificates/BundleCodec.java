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

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON encoding of {@link CertificateBundle bundles} and {@link LegacyMetadata legacy metadata}.
 * <p>
 * PEM payloads are base64 strings, timestamps ISO-8601 UTC instants, issuer data an embedded JSON document.
 */
public final class BundleCodec {

    private static final Logger LOG = LoggerFactory.getLogger(BundleCodec.class);

    /**
     * Highest bundle format version this code understands, and the one it writes.
     */
    public static final int BUNDLE_VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private BundleCodec() {
    }

    public static CertificateBundle toBundle(CertificateResource res, Instant createdAt, Instant updatedAt)
            throws JsonProcessingException {
        return new CertificateBundle(
                BUNDLE_VERSION,
                res.getSans(),
                res.getCertificatePEM(),
                res.getPrivateKeyPEM(),
                toRawIssuerData(res.getIssuerData()),
                createdAt,
                updatedAt);
    }

    public static CertificateResource toResource(CertificateBundle bundle, String issuerKey) {
        return new CertificateResource(
                bundle.getSans(),
                bundle.getCertificatePEM(),
                bundle.getPrivateKeyPEM(),
                fromRawIssuerData(bundle.getIssuerData()),
                issuerKey);
    }

    public static byte[] encode(CertificateBundle bundle) throws IOException {
        try {
            return MAPPER.writeValueAsBytes(bundle);
        } catch (JsonProcessingException err) {
            throw new IOException("encoding certificate bundle: " + err.getMessage(), err);
        }
    }

    /**
     * Decode a bundle. Bundles with a version newer than {@link #BUNDLE_VERSION} are accepted: known fields are
     * read, the others ignored.
     *
     * @param data stored bytes
     * @return the bundle
     * @throws BundleDecodingException if the data is not a bundle
     */
    public static CertificateBundle decode(byte[] data) throws BundleDecodingException {
        CertificateBundle bundle;
        try {
            bundle = MAPPER.readValue(data, CertificateBundle.class);
        } catch (IOException err) {
            throw new BundleDecodingException("decoding certificate bundle: " + err.getMessage(), err);
        }
        if (bundle == null) {
            throw new BundleDecodingException("decoding certificate bundle: empty document", null);
        }
        if (bundle.getVersion() > BUNDLE_VERSION) {
            LOG.warn("bundle version {} is newer than supported version {}", bundle.getVersion(), BUNDLE_VERSION);
        }
        return bundle;
    }

    /**
     * Read only the private key of a bundle, leaving the rest of the document undecoded.
     *
     * @param data stored bytes
     * @return the PEM private key, empty if the bundle has none
     * @throws BundleDecodingException if the data is not a bundle
     */
    public static byte[] decodePrivateKey(byte[] data) throws BundleDecodingException {
        try {
            JsonNode root = MAPPER.readTree(data);
            if (root == null || !root.isObject()) {
                throw new BundleDecodingException("decoding certificate bundle: not an object", null);
            }
            JsonNode key = root.get("private_key_pem");
            if (key == null || key.isNull()) {
                return new byte[0];
            }
            return key.binaryValue();
        } catch (BundleDecodingException err) {
            throw err;
        } catch (IOException err) {
            throw new BundleDecodingException("decoding certificate bundle: " + err.getMessage(), err);
        }
    }

    public static byte[] encodeMetadata(CertificateResource res) throws IOException {
        try {
            return MAPPER.writeValueAsBytes(new LegacyMetadata(res.getSans(), toRawIssuerData(res.getIssuerData())));
        } catch (JsonProcessingException err) {
            throw new IOException("encoding certificate metadata: " + err.getMessage(), err);
        }
    }

    public static LegacyMetadata decodeMetadata(byte[] data) throws BundleDecodingException {
        try {
            LegacyMetadata metadata = MAPPER.readValue(data, LegacyMetadata.class);
            if (metadata == null) {
                throw new BundleDecodingException("decoding certificate metadata: empty document", null);
            }
            return metadata;
        } catch (BundleDecodingException err) {
            throw err;
        } catch (IOException err) {
            throw new BundleDecodingException("decoding certificate metadata: " + err.getMessage(), err);
        }
    }

    /**
     * Validate issuer data and turn it into the raw JSON text embedded in the stored documents. Whitespace is
     * dropped, every other token is kept as written: numbers in particular keep their lexical form.
     *
     * @param issuerData JSON document, may be empty
     * @return compact JSON text, null if there is no issuer data
     * @throws JsonProcessingException if the data is not a single JSON value
     */
    static String toRawIssuerData(byte[] issuerData) throws JsonProcessingException {
        if (issuerData == null || issuerData.length == 0) {
            return null;
        }
        try (JsonParser parser = MAPPER.getFactory().createParser(issuerData)) {
            if (parser.nextToken() == null) {
                return null;
            }
            String raw = copyRawValue(parser);
            if (parser.nextToken() != null) {
                throw new JsonParseException(parser, "unexpected content after issuer data");
            }
            return raw;
        } catch (JsonProcessingException err) {
            throw err;
        } catch (IOException err) {
            throw new IllegalStateException(err); // reading from memory
        }
    }

    static byte[] fromRawIssuerData(String rawIssuerData) {
        if (rawIssuerData == null) {
            return new byte[0];
        }
        return rawIssuerData.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Copy the value the parser is positioned on, leaving the parser on its last token.
     */
    static String copyRawValue(JsonParser parser) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = MAPPER.getFactory().createGenerator(out)) {
            int depth = 0;
            do {
                JsonToken token = parser.currentToken();
                if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
                    generator.writeNumber(parser.getText());
                } else {
                    generator.copyCurrentEvent(parser);
                }
                if (token.isStructStart()) {
                    depth++;
                } else if (token.isStructEnd()) {
                    depth--;
                }
            } while (depth > 0 && parser.nextToken() != null);
        }
        return out.toString();
    }
}
