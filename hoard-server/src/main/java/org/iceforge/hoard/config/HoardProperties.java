package org.iceforge.hoard.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Storage locations and timings for the artifact cache and the version registry.
 */
@ConfigurationProperties(prefix = "hoard")
public class HoardProperties {

    private final Cache cache = new Cache();
    private final Registry registry = new Registry();
    private final Lock lock = new Lock();

    public Cache getCache() {
        return cache;
    }

    public Registry getRegistry() {
        return registry;
    }

    public Lock getLock() {
        return lock;
    }

    public static class Cache {

        /** Cache root; blobs live in {@code entries/}, the index in {@code metadata.json}. */
        private String rootDir = "./data/cache/models";

        /** Entries older than this are misses and get swept. */
        private Duration ttl = Duration.ofHours(24);

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Registry {

        /** Version root; also holds the serving copy of each active version. */
        private String rootDir = "./data/models";

        public String getRootDir() {
            return rootDir;
        }

        public void setRootDir(String rootDir) {
            this.rootDir = rootDir;
        }
    }

    public static class Lock {

        /** Max wait for a metadata lock before the operation fails. */
        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
