/**
 * Frequency.java
 *
 * perf 分支采样的采样频率。这是一个带标签的联合类型：
 * Max 使用 perf 支持的最高频率，Default 不传任何频率参数，Specific 传入一个明确的采样率。
 * 持久化时通过 "frequency_mode" 字段区分变体。
 */
package club.ppmc.girasol.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "frequency_mode")
@JsonSubTypes({
        @JsonSubTypes.Type(Frequency.Max.class),
        @JsonSubTypes.Type(Frequency.Default.class),
        @JsonSubTypes.Type(Frequency.Specific.class)
})
public sealed interface Frequency permits Frequency.Max, Frequency.Default, Frequency.Specific {

    @JsonTypeName("Max")
    record Max() implements Frequency {}

    @JsonTypeName("Default")
    record Default() implements Frequency {}

    /**
     * @param value 每秒采样次数。
     */
    @JsonTypeName("Specific")
    record Specific(long value) implements Frequency {
        public Specific {
            if (value < 0) {
                throw new IllegalArgumentException("采样频率不能为负数: " + value);
            }
        }
    }

    static Frequency defaultFrequency() {
        return new Default();
    }
}
