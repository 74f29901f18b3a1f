package io.changestream.api;

import io.changestream.store.ChangeLog;
import io.changestream.store.ConsumerProgressStore;
import io.changestream.store.EventStore;
import io.changestream.store.InMemoryConsumerProgressStore;
import io.changestream.store.InMemoryEventStore;
import io.changestream.store.pg.PostgresConsumerProgressStore;
import io.changestream.store.pg.PostgresEventStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;

@Configuration
public class Beans {
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Profile("inmem")
    EventStore inMemoryStore(Clock clock) {
        return new InMemoryEventStore(clock);
    }

    @Bean
    @Profile("inmem")
    ConsumerProgressStore inMemoryProgressStore() {
        return new InMemoryConsumerProgressStore();
    }

    @Bean
    @Profile("pg")
    EventStore postgresStore(JdbcTemplate jdbc, Clock clock) {
        return new PostgresEventStore(jdbc, clock);
    }

    @Bean
    @Profile("pg")
    ConsumerProgressStore postgresProgressStore(JdbcTemplate jdbc) {
        return new PostgresConsumerProgressStore(jdbc);
    }

    @Bean
    ChangeLog changeLog(EventStore store, ConsumerProgressStore progress, Clock clock) {
        return new ChangeLog(store, progress, clock);
    }
}
