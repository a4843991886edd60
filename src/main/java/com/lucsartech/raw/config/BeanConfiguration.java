package com.lucsartech.raw.config;

import com.lucsartech.raw.conversion.FormatAdapter;
import com.lucsartech.raw.conversion.MultiFormatConverter;
import com.lucsartech.raw.decode.ImageIoDecoder;
import com.lucsartech.raw.decode.RawDecoder;
import com.lucsartech.raw.encode.ImageEncoder;
import com.lucsartech.raw.encode.ImageIoEncoder;
import com.lucsartech.raw.optimize.SettingsOptimizer;
import com.lucsartech.raw.pipeline.BatchScheduler;
import com.lucsartech.raw.pipeline.PreviewExtractor;
import com.lucsartech.raw.session.SessionFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.ConfigurationPropertiesBinding;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring Bean configuration for the converter components.
 * A custom {@link RawDecoder} or {@link ImageEncoder} bean replaces the ImageIO defaults.
 */
@Configuration
public class BeanConfiguration {

    // static: the binder needs it before ConverterProperties is created
    @Bean
    @ConfigurationPropertiesBinding
    public static OutputFormatConverter outputFormatConverter() {
        return new OutputFormatConverter();
    }

    @Bean
    @ConditionalOnMissingBean
    public RawDecoder rawDecoder() {
        return new ImageIoDecoder();
    }

    @Bean
    @ConditionalOnMissingBean
    public ImageEncoder imageEncoder() {
        return new ImageIoEncoder();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService engineExecutor(ConverterProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getEngine().getWorkerThreads(), r -> {
            Thread t = new Thread(r, "engine-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public SessionFactory sessionFactory(RawDecoder rawDecoder, ExecutorService engineExecutor) {
        return new SessionFactory(rawDecoder, engineExecutor);
    }

    @Bean
    public FormatAdapter formatAdapter(ImageEncoder imageEncoder) {
        return new FormatAdapter(imageEncoder);
    }

    @Bean
    public MultiFormatConverter multiFormatConverter(FormatAdapter formatAdapter) {
        return new MultiFormatConverter(formatAdapter);
    }

    @Bean
    public SettingsOptimizer settingsOptimizer() {
        return new SettingsOptimizer();
    }

    @Bean
    public BatchScheduler batchScheduler(RawDecoder rawDecoder, FormatAdapter formatAdapter) {
        return new BatchScheduler(rawDecoder, formatAdapter);
    }

    @Bean
    public PreviewExtractor previewExtractor(RawDecoder rawDecoder, FormatAdapter formatAdapter) {
        return new PreviewExtractor(rawDecoder, formatAdapter);
    }
}
