package io.github.yok.masklink.config;

import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds the scalar shorthand {@code column: hash} to a {@link RuleProperties}.
 */
@Component
@ConfigurationPropertiesBinding
public class RulePropertiesConverter implements Converter<String, RuleProperties> {

    @Override
    public RuleProperties convert(String source) {
        return RuleProperties.of(source.trim());
    }
}
