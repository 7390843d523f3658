package com.resourcelocator;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Secure Resource Locator.
 *
 * <p>Brokers access between application identities and named resources without
 * holding the resources' data:
 *
 * <ul>
 *   <li><strong>Resolution</strong>: logical name plus security context to a connection
 *       descriptor or an audited denial</li>
 *   <li><strong>Policies</strong>: boolean AND/OR condition trees, or cosine-similarity
 *       vector policies</li>
 *   <li><strong>Capability tokens</strong>: HMAC-checked, time-boxed, single redemption</li>
 *   <li><strong>Audit trail</strong>: one terminal event per resolution, through the
 *       Storage Adapter</li>
 * </ul>
 *
 * <p>Storage is in-memory by default; the {@code jpa} profile switches to PostgreSQL.
 *
 * @author Security Team
 * @since 1.0.0
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class ResourceLocatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResourceLocatorApplication.class, args);

        log.info("""
            Secure Resource Locator started
              Policy evaluation: boolean trees, vector similarity
              Capability tokens: HMAC-SHA256
            """);
    }
}
