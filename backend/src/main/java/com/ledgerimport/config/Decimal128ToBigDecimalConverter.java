package com.ledgerimport.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigDecimal;

/**
 * Reads Decimal128 amounts as BigDecimal, keeping the stored scale (12.50 stays 12.50).
 */
@ReadingConverter
public class Decimal128ToBigDecimalConverter implements Converter<Decimal128, BigDecimal> {

    @Override
    public BigDecimal convert(Decimal128 source) {
        if (source.isNaN() || source.isInfinite()) {
            throw new IllegalStateException("Non-finite Decimal128 in a money field: " + source);
        }
        return source.bigDecimalValue();
    }
}
