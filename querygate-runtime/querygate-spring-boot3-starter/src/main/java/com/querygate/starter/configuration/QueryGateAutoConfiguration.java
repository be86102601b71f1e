package com.querygate.starter.configuration;

import com.querygate.api.guardian.GuardianSetResolver;
import com.querygate.api.security.QueryAuthorizer;
import com.querygate.core.codec.QueryRequestCodec;
import com.querygate.core.config.QueryGateConfig;
import com.querygate.core.event.EventBus;
import com.querygate.core.guardian.DefaultGuardianSetResolver;
import com.querygate.core.guardian.Web3jContractCallerFactory;
import com.querygate.core.reload.PermissionFileWatcher;
import com.querygate.core.security.DefaultQueryAuthorizer;
import com.querygate.core.security.PermissionRegistry;
import com.querygate.core.spi.ContractCallerFactory;
import com.querygate.core.spi.QueryRequestDecoder;
import com.querygate.starter.config.QueryGateProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(QueryGateProperties.class)
@ConditionalOnProperty(prefix = "querygate", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueryGateAutoConfiguration {

    @Bean
    public QueryGateConfig queryGateConfig(QueryGateProperties properties) {
        QueryGateConfig config = properties.toConfig();
        config.validate();
        return config;
    }

    // 将事件总线注册为 Bean (解耦)
    @Bean
    @ConditionalOnMissingBean
    public EventBus queryGateEventBus() {
        return new EventBus();
    }

    // 启动时加载，失败则容器启动失败
    @Bean
    public PermissionRegistry permissionRegistry(QueryGateConfig config, EventBus eventBus) {
        return new PermissionRegistry(Path.of(config.getPermissionFile()), eventBus);
    }

    @Bean
    @ConditionalOnMissingBean(QueryRequestDecoder.class)
    public QueryRequestDecoder queryRequestDecoder() {
        return new QueryRequestCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public QueryAuthorizer queryAuthorizer(PermissionRegistry registry, QueryRequestDecoder decoder) {
        return new DefaultQueryAuthorizer(registry, decoder);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(ContractCallerFactory.class)
    public Web3jContractCallerFactory contractCallerFactory() {
        return new Web3jContractCallerFactory();
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardianSetResolver guardianSetResolver(ContractCallerFactory callerFactory, QueryGateConfig config) {
        return new DefaultGuardianSetResolver(callerFactory, config.getGuardianSetTimeout());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "querygate.permissions", name = "watch", havingValue = "true")
    public PermissionFileWatcher permissionFileWatcher(PermissionRegistry registry, QueryGateConfig config) {
        return new PermissionFileWatcher(registry, config.getReloadDebounceMillis());
    }
}
