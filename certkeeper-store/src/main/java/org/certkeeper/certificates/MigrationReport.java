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
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of {@link CertificateStore#migrateAll(String)}.
 */
@Getter
@ToString
public class MigrationReport {

    private final String issuerKey;
    private int migrated;
    private int skipped;
    private int failed;
    private final List<String> failedDomains = new ArrayList<>();

    public MigrationReport(String issuerKey) {
        this.issuerKey = issuerKey;
    }

    void migrated() {
        migrated++;
        CertificateStoreStats.migrated();
    }

    void skipped() {
        skipped++;
        CertificateStoreStats.skipped();
    }

    void failed(String domain) {
        failed++;
        failedDomains.add(domain);
        CertificateStoreStats.failed();
    }

    public List<String> getFailedDomains() {
        return Collections.unmodifiableList(failedDomains);
    }

    public boolean isSuccessful() {
        return failed == 0;
    }
}
