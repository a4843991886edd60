package com.lucsartech.raw.config;

import com.lucsartech.raw.encode.OutputFormat;
import org.springframework.core.convert.converter.Converter;

/**
 * Binds {@code converter.batch.format} by format name or file extension,
 * so {@code jpg}, {@code tif} and {@code WEBP} are all accepted.
 */
public class OutputFormatConverter implements Converter<String, OutputFormat> {

    @Override
    public OutputFormat convert(String source) {
        return OutputFormat.parse(source);
    }
}
