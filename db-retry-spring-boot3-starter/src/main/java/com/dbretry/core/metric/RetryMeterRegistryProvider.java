package com.dbretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 重试指标使用的注册表
 * <p>
 * 本地 Simple 注册表始终存在, 业务方的注册表（含嵌套的 Composite）展开后并入;
 * 所有 db.retry.* 指标带 component=db-retry 标签.
 */
public class RetryMeterRegistryProvider {

    public static final String COMPONENT_TAG = "component";

    public static final String COMPONENT = "db-retry";

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final SimpleMeterRegistry local = new SimpleMeterRegistry();

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        composite.config().commonTags(COMPONENT_TAG, COMPONENT);
        composite.add(local);
        if (discovered != null) {
            discovered.forEach(this::attach);
        }
    }

    private void attach(MeterRegistry registry) {
        if (registry instanceof CompositeMeterRegistry nested) {
            nested.getRegistries().forEach(this::attach);
        } else if (!composite.getRegistries().contains(registry)) {
            composite.add(registry);
        }
    }

    public MeterRegistry getRegistry() { return composite; }

    /** 未接监控后端时读取指标 */
    public SimpleMeterRegistry getLocalRegistry() { return local; }
}
