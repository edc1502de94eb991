package io.github.vevoly.rewards.starter;

import io.github.vevoly.rewards.api.constants.JRewardsLedgerConstant;
import io.github.vevoly.rewards.core.RewardsLedgerEngine;
import io.github.vevoly.rewards.starter.endpoint.RewardsLedgerEndpoint;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 负责注册 Admin Endpoint 的自动配置类
 * Registers the admin endpoint when actuator is present and {@code j-rewards-ledger.admin.enabled=true}.
 *
 * @author vevoly
 * @since 1.0.0
 */
@Configuration
@AutoConfigureAfter(RewardsLedgerAutoConfiguration.class)
@ConditionalOnClass(name = "org.springframework.boot.actuate.endpoint.annotation.Endpoint")
@ConditionalOnProperty(name = JRewardsLedgerConstant.ADMIN_ENABLED_PROPERTY, havingValue = "true")
public class RewardsLedgerEndpointAutoConfiguration {

    @Bean
    @ConditionalOnBean(RewardsLedgerEngine.class)
    @ConditionalOnAvailableEndpoint(endpoint = RewardsLedgerEndpoint.class)
    public RewardsLedgerEndpoint rewardsLedgerEndpoint(RewardsLedgerEngine engine) {
        return new RewardsLedgerEndpoint(engine);
    }
}
