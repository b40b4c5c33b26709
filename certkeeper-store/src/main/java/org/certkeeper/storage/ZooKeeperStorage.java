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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.apache.curator.ensemble.fixed.FixedEnsembleProvider;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.api.ACLProvider;
import org.apache.curator.framework.imps.DefaultACLProvider;
import org.apache.curator.framework.recipes.locks.InterProcessMutex;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.curator.utils.ZookeeperFactory;
import org.apache.zookeeper.KeeperException;
import org.apache.zookeeper.Watcher;
import org.apache.zookeeper.ZooDefs;
import org.apache.zookeeper.ZooKeeper;
import org.apache.zookeeper.client.ZKClientConfig;
import org.apache.zookeeper.data.ACL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Storage} based on ZooKeeper. Every key is a znode under the base path; values are the znode data.
 * <p>
 * Locks are Curator {@link InterProcessMutex}es: they live as long as the ZooKeeper session, hence there is no
 * lease to renew.
 */
public class ZooKeeperStorage implements Storage, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ZooKeeperStorage.class);

    public static final String DEFAULT_BASE_PATH = "/certkeeper";

    private final CuratorFramework client;
    private final String basePath;
    private final ConcurrentHashMap<String, InterProcessMutex> mutexes = new ConcurrentHashMap<>();

    public ZooKeeperStorage(String zkAddress, int zkTimeout, boolean zkAcl, String basePath, Properties zkProperties) {
        ACLProvider aclProvider = new DefaultACLProvider();
        if (zkAcl) {
            aclProvider = new ACLProvider() {
                @Override
                public List<ACL> getDefaultAcl() {
                    return ZooDefs.Ids.CREATOR_ALL_ACL;
                }

                @Override
                public List<ACL> getAclForPath(String path) {
                    return getDefaultAcl();
                }
            };
        }

        final ZKClientConfig zkClientConfig = new ZKClientConfig();
        zkProperties.forEach((k, v) -> {
            zkClientConfig.setProperty(k.toString(), v.toString());
            LOG.info("Setting ZK client config: {}={}", k, v);
        });
        ZookeeperFactory zkFactory = (String connect, int timeout, Watcher wtchr, boolean canBeReadOnly) -> {
            LOG.info("Creating ZK client: {}, timeout {}, canBeReadOnly:{}", connect, timeout, canBeReadOnly);
            return new ZooKeeper(connect, timeout, wtchr, canBeReadOnly, zkClientConfig);
        };

        this.basePath = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        this.client = CuratorFrameworkFactory
                .builder()
                .aclProvider(aclProvider)
                .zookeeperFactory(zkFactory)
                .sessionTimeoutMs(zkTimeout)
                .connectionTimeoutMs(zkTimeout)
                .waitForShutdownTimeoutMs(1000) // useful for tests
                .retryPolicy(new ExponentialBackoffRetry(1000, 2))
                .ensembleProvider(new FixedEnsembleProvider(zkAddress, true))
                .build();
    }

    public void start() throws IOException {
        client.start();
        try {
            if (!client.blockUntilConnected(client.getZookeeperClient().getConnectionTimeoutMs(), TimeUnit.MILLISECONDS)) {
                throw new IOException("First connection to ZK cannot be established");
            }
            LOG.info("First connection to ZK established with success");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IOException(ex);
        }
    }

    private String path(String key) {
        return key.startsWith("/") ? basePath + key : basePath + "/" + key;
    }

    private String toKey(String path) {
        return path.substring(basePath.length() + 1);
    }

    @Override
    public byte[] load(String key) throws IOException {
        try {
            byte[] data = client.getData().forPath(path(key));
            return data != null ? data : new byte[0];
        } catch (KeeperException.NoNodeException err) {
            throw new KeyNotFoundException(key, err);
        } catch (Exception err) {
            throw new IOException("Cannot load " + key, err);
        }
    }

    @Override
    public void store(String key, byte[] value) throws IOException {
        try {
            client.create()
                    .orSetData()
                    .creatingParentsIfNeeded()
                    .forPath(path(key), value);
        } catch (Exception err) {
            throw new IOException("Cannot store " + key, err);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            return client.checkExists().forPath(path(key)) != null;
        } catch (Exception err) {
            LOG.error("Cannot check existence of {}", key, err);
            return false;
        }
    }

    @Override
    public void delete(String key) throws IOException {
        try {
            client.delete().forPath(path(key));
        } catch (KeeperException.NoNodeException err) {
            LOG.debug("{} already deleted", key);
        } catch (KeeperException.NotEmptyException err) {
            throw new IOException("cannot delete " + key + ": not empty", err);
        } catch (Exception err) {
            throw new IOException("Cannot delete " + key, err);
        }
    }

    @Override
    public List<String> list(String prefix, boolean recursive) throws IOException {
        List<String> result = new ArrayList<>();
        try {
            collect(path(prefix), recursive, result);
        } catch (KeeperException.NoNodeException err) {
            throw new KeyNotFoundException(prefix, err);
        } catch (Exception err) {
            throw new IOException("Cannot list " + prefix, err);
        }
        Collections.sort(result);
        return result;
    }

    private void collect(String path, boolean recursive, List<String> result) throws Exception {
        for (String child : client.getChildren().forPath(path)) {
            String childPath = path + "/" + child;
            result.add(toKey(childPath));
            if (recursive) {
                collect(childPath, true, result);
            }
        }
    }

    @Override
    public boolean lock(String key, long timeout, TimeUnit unit) throws IOException, InterruptedException {
        InterProcessMutex mutex = mutexes.computeIfAbsent(key, (mId) -> {
            return new InterProcessMutex(client, basePath + "/locks/" + key.replaceAll("[^\\w@.-]", "_"));
        });
        try {
            return mutex.acquire(timeout, unit);
        } catch (InterruptedException err) {
            throw err;
        } catch (Exception err) {
            throw new IOException("Failed to acquire lock " + key, err);
        }
    }

    @Override
    public void unlock(String key) throws IOException {
        InterProcessMutex mutex = mutexes.get(key);
        if (mutex == null) {
            throw new IOException("Lock " + key + " was never acquired");
        }
        try {
            mutex.release();
        } catch (Exception err) {
            throw new IOException("Failed to release lock " + key, err);
        }
    }

    @Override
    public void close() {
        client.close();
        mutexes.clear();
    }

    @Override
    public String toString() {
        return "ZooKeeperStorage:" + basePath;
    }
}
