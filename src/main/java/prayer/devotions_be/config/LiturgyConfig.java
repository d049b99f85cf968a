package prayer.devotions_be.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import prayer.devotions_be.lectionary.LectionaryStore;
import prayer.devotions_be.liturgy.ObservanceRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class LiturgyConfig {

    @Bean
    public ObservanceRegistry observanceRegistry(DevotionsProperties props, ObjectMapper objectMapper) {
        return ObservanceRegistry.fromClasspath(props.getObservanceResource(), objectMapper);
    }

    @Bean
    public LectionaryStore lectionaryStore(DevotionsProperties props, ObjectMapper objectMapper) {
        return LectionaryStore.fromClasspath(props.getLectionaryResource(), objectMapper);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
