package cn.clazs.redislimiter.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 配额计数存放的位置
 *
 * @author clazs
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor
public enum QuotaStorage {

    /**
     * 进程内 Caffeine 计数，每个实例各算各的
     */
    LOCAL("local", false),

    /**
     * Redis 计数，同一个 Key 在所有实例之间共享配额
     */
    REDIS("redis", true);

    private final String code;

    /**
     * 多个服务实例是否共享同一份计数
     */
    private final boolean distributed;

    /**
     * 按配置代码查找，忽略大小写
     *
     * @throws IllegalArgumentException 代码不存在
     */
    public static QuotaStorage fromCode(String code) {
        for (QuotaStorage storage : values()) {
            if (storage.code.equalsIgnoreCase(code)) {
                return storage;
            }
        }
        throw new IllegalArgumentException("未知的配额存储类型: " + code);
    }
}
