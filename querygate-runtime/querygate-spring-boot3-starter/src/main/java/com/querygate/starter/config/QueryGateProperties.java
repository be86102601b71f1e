package com.querygate.starter.config;

import com.querygate.core.config.QueryGateConfig;
import com.querygate.core.guardian.DefaultGuardianSetResolver;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Setter
@Getter
@ConfigurationProperties(prefix = "querygate")
public class QueryGateProperties {

    private boolean enabled = true;

    private Permissions permissions = new Permissions();

    private Guardian guardian = new Guardian();

    @Setter
    @Getter
    public static class Permissions {
        // 权限文件路径 (YAML 或 JSON)
        private String file;
        private boolean watch = false;
        private long reloadDebounceMillis = 500;
    }

    @Setter
    @Getter
    public static class Guardian {
        private String rpcUrl;
        private String coreBridgeAddress;
        private Duration timeout = DefaultGuardianSetResolver.DEFAULT_TIMEOUT;
    }

    public QueryGateConfig toConfig() {
        return QueryGateConfig.builder()
                .permissionFile(permissions.getFile())
                .watchPermissionFile(permissions.isWatch())
                .reloadDebounceMillis(permissions.getReloadDebounceMillis())
                .rpcUrl(guardian.getRpcUrl())
                .coreBridgeAddress(guardian.getCoreBridgeAddress())
                .guardianSetTimeout(guardian.getTimeout())
                .build();
    }
}
