package com.ledgerimport.config;

import org.bson.types.Decimal128;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Writes BigDecimal amounts as Decimal128. Values beyond 34 significant digits (only possible from division
 * results such as variance ratios) are rounded to fit instead of failing the write.
 */
@WritingConverter
public class BigDecimalToDecimal128Converter implements Converter<BigDecimal, Decimal128> {

    @Override
    public Decimal128 convert(BigDecimal source) {
        if (source.precision() > MathContext.DECIMAL128.getPrecision()) {
            return new Decimal128(source.round(MathContext.DECIMAL128));
        }
        return new Decimal128(source);
    }
}
