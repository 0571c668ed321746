package io.github.yok.masklink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * application.yml 相当のプロパティが設定クラスへバインドされることを確認します。
 */
class ConfigurationBindingTest {

    private final ApplicationContextRunner runner =
            new ApplicationContextRunner().withUserConfiguration(BindingConfiguration.class);

    @Configuration
    @EnableConfigurationProperties({ConnectionConfig.class, PipelineConfig.class,
            MaskingConfig.class})
    @Import(RulePropertiesConverter.class)
    static class BindingConfiguration {
    }

    @Test
    void bind_正常ケース_スカラーとオブジェクトのマスキングルールが混在してバインドされること() {
        runner.withPropertyValues("masking.salt=pepper",
                "masking.rules.customers.email=hash",
                "masking.rules.customers.notes.type=redact",
                "masking.rules.customers.notes.keep-length=true",
                "masking.rules.customers.notes.mask-char=#").run(context -> {
                    MaskingConfig config = context.getBean(MaskingConfig.class);
                    assertEquals("pepper", config.getSalt());
                    RuleProperties email = config.getRules().get("customers").get("email");
                    assertEquals("hash", email.getType());
                    RuleProperties notes = config.getRules().get("customers").get("notes");
                    assertEquals("redact", notes.getType());
                    assertTrue(notes.isKeepLength());
                    assertEquals("#", notes.getMaskChar());
                });
    }

    @Test
    void bind_正常ケース_テーブル定義とリトライ設定がバインドされること() {
        runner.withPropertyValues("pipeline.env-name=qa", "pipeline.parallel-tables=true",
                "pipeline.allowed-runner-roles[0]=qa_runner", "pipeline.tables[0].name=customers",
                "pipeline.tables[0].batch-size=100", "pipeline.tables[0].primary-key[0]=customer_id",
                "pipeline.load-retry.max-attempts=2", "pipeline.load-retry.backoff=fixed",
                "pipeline.load-retry.initial-delay=250ms",
                "connections.destination.url=jdbc:h2:mem:binding").run(context -> {
                    PipelineConfig pipeline = context.getBean(PipelineConfig.class);
                    assertEquals("qa", pipeline.getEnvName());
                    assertTrue(pipeline.isParallelTables());
                    assertEquals(List.of("qa_runner"), pipeline.getAllowedRunnerRoles());
                    assertEquals(1, pipeline.getTables().size());
                    assertEquals(100, pipeline.getTables().get(0).getBatchSize());
                    assertEquals(List.of("customer_id"),
                            pipeline.getTables().get(0).getPrimaryKey());
                    assertEquals(PipelineConfig.Backoff.FIXED,
                            pipeline.getLoadRetry().getBackoff());
                    assertEquals(Duration.ofMillis(250),
                            pipeline.getLoadRetry().getInitialDelay());

                    ConnectionConfig connections = context.getBean(ConnectionConfig.class);
                    assertEquals("jdbc:h2:mem:binding",
                            connections.getDestination().resolveUrl());
                });
    }
}
