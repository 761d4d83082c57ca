package com.expektra.opendata.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringJUnitConfig
@ContextConfiguration(initializers = ConfigDataApplicationContextInitializer.class)
@EnableConfigurationProperties({EsettProperties.class, SyncProperties.class, MetadataProperties.class})
@TestPropertySource(properties = {
        "expektra.esett.base-url=http://localhost:9999/esett",
        "expektra.esett.max-window=7d",
        "expektra.esett.call-timeout=15s",
        "expektra.esett.fetch-timeout=45s",
        "expektra.sync.default-page-size=250",
        "expektra.sync.max-page-size=5000",
        "expektra.sync.fetch-threads=2",
        "expektra.sync.wait-timeout=20s",
        "expektra.metadata.key-prefix=test:meta:",
        "expektra.metadata.ttl-hours=6"
})
class ExpektraPropertiesTest {

    @Autowired
    private EsettProperties esettProperties;

    @Autowired
    private SyncProperties syncProperties;

    @Autowired
    private MetadataProperties metadataProperties;

    @Test
    void shouldBindConfigurationProperties() {
        assertThat(esettProperties.getBaseUrl()).isEqualTo("http://localhost:9999/esett");
        assertThat(esettProperties.getMaxWindow()).isEqualTo(Duration.ofDays(7));
        assertThat(esettProperties.getCallTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(esettProperties.getFetchTimeout()).isEqualTo(Duration.ofSeconds(45));
        assertThat(syncProperties.getDefaultPageSize()).isEqualTo(250);
        assertThat(syncProperties.getMaxPageSize()).isEqualTo(5000);
        assertThat(syncProperties.getFetchThreads()).isEqualTo(2);
        assertThat(syncProperties.getWaitTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(metadataProperties.getKeyPrefix()).isEqualTo("test:meta:");
        assertThat(metadataProperties.getTtlHours()).isEqualTo(6);
    }

    @Test
    void shouldKeepDefaultsForUnsetProperties() {
        assertThat(esettProperties.getConnectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(esettProperties.getReadTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(syncProperties.getFetchQueueCapacity()).isEqualTo(100);
    }

    @Test
    void shouldDefaultToPublicEsettEndpoint() {
        EsettProperties defaults = new EsettProperties();

        assertThat(defaults.getBaseUrl()).isEqualTo("https://api.opendata.esett.com/");
        assertThat(defaults.getMaxWindow()).isEqualTo(Duration.ofDays(31));
        assertThat(EsettClientConfig.withTrailingSlash("http://localhost:9999/esett"))
                .isEqualTo("http://localhost:9999/esett/");
    }
}
