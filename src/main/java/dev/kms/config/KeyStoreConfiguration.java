package dev.kms.config;

import dev.kms.codec.RecordType;
import dev.kms.core.KMSException;
import dev.kms.core.model.Key;
import dev.kms.fs.StoreFile;
import dev.kms.fs.StoreFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

@Configuration
@EnableConfigurationProperties(KmsProperties.class)
public class KeyStoreConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KeyStoreConfiguration.class);

    @Bean
    public StoreFile<Key> keyStoreFile(final KmsProperties properties) throws IOException, KMSException {
        log.info("Opening key store: {}", properties);
        return StoreFiles.open(properties.toOptions(), RecordType.KEYS);
    }
}
