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
package org.certkeeper.storage;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import java.io.IOException;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.curator.test.TestingServer;
import org.certkeeper.certificates.CertificateResource;
import org.certkeeper.certificates.CertificateStore;
import org.certkeeper.certificates.StorageKeys;
import org.certkeeper.certificates.StorageMode;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ZooKeeperStorageTest {

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private TestingServer testingServer;

    @Before
    public void startZooKeeper() throws Exception {
        testingServer = new TestingServer(-1, tmpDir.newFolder());
        testingServer.start();
    }

    @After
    public void stopZooKeeper() throws Exception {
        if (testingServer != null) {
            testingServer.close();
        }
    }

    private ZooKeeperStorage newStorage() throws Exception {
        ZooKeeperStorage storage = new ZooKeeperStorage(testingServer.getConnectString(), 6000, false /* acl */,
                ZooKeeperStorage.DEFAULT_BASE_PATH, new Properties());
        storage.start();
        return storage;
    }

    @Test
    public void testKeyValue() throws Exception {
        try (ZooKeeperStorage storage = newStorage()) {
            assertFalse(storage.exists("certificates/issuer/example.com/example.com.crt"));
            KeyNotFoundException err = assertThrows(KeyNotFoundException.class,
                    () -> storage.load("certificates/issuer/example.com/example.com.crt"));
            assertThat(err.getKey(), is("certificates/issuer/example.com/example.com.crt"));

            storage.store("certificates/issuer/example.com/example.com.crt", "cert".getBytes(UTF_8));
            storage.store("certificates/issuer/example.com/example.com.key", "key".getBytes(UTF_8));
            storage.store("certificates/issuer/a.com.bundle.json", "{}".getBytes(UTF_8));
            assertThat(storage.load("certificates/issuer/example.com/example.com.crt"), is("cert".getBytes(UTF_8)));
            storage.store("certificates/issuer/example.com/example.com.crt", "renewed".getBytes(UTF_8));
            assertThat(storage.load("certificates/issuer/example.com/example.com.crt"), is("renewed".getBytes(UTF_8)));

            assertThat(storage.list("certificates/issuer", false), is(List.of(
                    "certificates/issuer/a.com.bundle.json",
                    "certificates/issuer/example.com")));
            assertThat(storage.list("certificates/issuer", true), is(List.of(
                    "certificates/issuer/a.com.bundle.json",
                    "certificates/issuer/example.com",
                    "certificates/issuer/example.com/example.com.crt",
                    "certificates/issuer/example.com/example.com.key")));
            assertThrows(KeyNotFoundException.class, () -> storage.list("certificates/other", true));

            assertThrows(IOException.class, () -> storage.delete("certificates/issuer/example.com"));
            storage.delete("certificates/issuer/example.com/example.com.crt");
            storage.delete("certificates/issuer/example.com/example.com.crt");
            storage.delete("certificates/issuer/example.com/example.com.key");
            storage.delete("certificates/issuer/example.com");
            assertFalse(storage.exists("certificates/issuer/example.com"));
        }
    }

    @Test
    public void testSharedAcrossClients() throws Exception {
        try (ZooKeeperStorage peer1 = newStorage();
             ZooKeeperStorage peer2 = newStorage()) {
            CertificateResource res = new CertificateResource(List.of("example.com"), "certificate".getBytes(UTF_8),
                    "private key".getBytes(UTF_8), null);
            CertificateStore.withMode(peer1, StorageMode.LEGACY).save("issuer", res);

            CertificateStore store2 = CertificateStore.withMode(peer2, StorageMode.BUNDLE);
            assertThat(store2.load("issuer", "example.com"), is(res));
            assertTrue(store2.migrate("issuer", "example.com"));
            assertTrue(peer1.exists(StorageKeys.siteBundle("issuer", "example.com")));
            assertFalse(peer1.exists(StorageKeys.siteCert("issuer", "example.com")));
        }
    }

    @Test
    public void testLock() throws Exception {
        try (ZooKeeperStorage peer1 = newStorage();
             ZooKeeperStorage peer2 = newStorage()) {
            assertTrue(peer1.lock("issue_cert_example.com", 1, TimeUnit.SECONDS));
            assertFalse(peer2.lock("issue_cert_example.com", 200, TimeUnit.MILLISECONDS));

            CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(() -> {
                try {
                    return peer2.lock("issue_cert_example.com", 10, TimeUnit.SECONDS);
                } catch (Exception err) {
                    throw new RuntimeException(err);
                }
            });
            peer1.unlock("issue_cert_example.com");
            assertTrue(waiting.get(10, TimeUnit.SECONDS));

            assertThrows(IOException.class, () -> peer1.unlock("never_acquired"));
        }
    }
}
