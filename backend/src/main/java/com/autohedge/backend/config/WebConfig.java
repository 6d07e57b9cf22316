package com.autohedge.backend.config;

import com.autohedge.backend.exception.ValidationException;
import com.autohedge.backend.model.TradeStatus;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    /** Lets {@code ?status=} take the lower-case wire names. */
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new Converter<String, TradeStatus>() {
            @Override
            public TradeStatus convert(String source) {
                if (source.isBlank()) {
                    return null;
                }
                return TradeStatus.fromWire(source)
                        .orElseThrow(() -> new ValidationException("Unknown trade status '" + source + "'"));
            }
        });
    }
}
