package com.ledgerimport.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

/**
 * Money is stored as Decimal128 so budget actuals can be accumulated server-side with $inc without
 * binary rounding. LocalDate/Instant use the driver's UTC codecs, so transaction dates and budget periods do not
 * shift with the JVM time zone. Indexes come from the document annotations (auto-index-creation).
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return MongoCustomConversions.create(adapter -> {
            adapter.useNativeDriverJavaTimeCodecs();
            adapter.registerConverter(new BigDecimalToDecimal128Converter());
            adapter.registerConverter(new Decimal128ToBigDecimalConverter());
        });
    }
}
