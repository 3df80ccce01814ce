package org.iceforge.hoard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.hoard.cache.ArtifactCache;
import org.iceforge.hoard.cache.CacheSettings;
import org.iceforge.hoard.hash.HashVerifier;
import org.iceforge.hoard.registry.RegistrySettings;
import org.iceforge.hoard.registry.VersionRegistry;
import org.iceforge.hoard.serial.RawBytesSerializer;
import org.iceforge.hoard.store.FileLockService;
import org.iceforge.hoard.store.HoardObjectMappers;
import org.iceforge.hoard.store.LockService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class HoardConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Shared by the metadata documents and the HTTP/CLI responses.
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return HoardObjectMappers.metadataMapper();
    }

    @Bean
    public HashVerifier hashVerifier() {
        return new HashVerifier();
    }

    @Bean
    public LockService lockService(HoardProperties props) {
        return new FileLockService(props.getLock().getTimeout());
    }

    @Bean
    public ArtifactCache<byte[]> artifactCache(HoardProperties props, HashVerifier hasher, ObjectMapper mapper,
                                               LockService locks, Clock clock) {
        CacheSettings settings = new CacheSettings(Path.of(props.getCache().getRootDir()), props.getCache().getTtl());
        return new ArtifactCache<>(settings, new RawBytesSerializer(), hasher, mapper, locks, clock);
    }

    @Bean
    public VersionRegistry versionRegistry(HoardProperties props, HashVerifier hasher, ObjectMapper mapper,
                                           LockService locks, Clock clock) {
        return new VersionRegistry(new RegistrySettings(Path.of(props.getRegistry().getRootDir())),
                hasher, mapper, locks, clock);
    }
}
