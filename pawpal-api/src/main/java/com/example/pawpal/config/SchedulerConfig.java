package com.example.pawpal.config;

import com.example.pawpal.model.User;
import com.example.pawpal.service.ConflictDetector;
import com.example.pawpal.service.RecurrenceEngine;
import com.example.pawpal.service.Scheduler;
import com.example.pawpal.store.InMemoryPetStore;
import com.example.pawpal.store.InMemoryTaskStore;
import com.example.pawpal.store.InMemoryUserStore;
import com.example.pawpal.store.InMemoryWalkStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public User owner(PawPalProperties properties, InMemoryUserStore userStore) {
        PawPalProperties.Owner owner = properties.getOwner();
        User user = userStore.findById(owner.getId())
                .orElseGet(() -> new User(owner.getId(), owner.getName(), owner.getEmail()));
        userStore.save(user);
        log.info("Scheduling for owner {} ({})", user.getUserId(), user.getName());
        return user;
    }

    @Bean
    public Scheduler scheduler(User owner,
                               InMemoryPetStore petStore,
                               InMemoryTaskStore taskStore,
                               InMemoryWalkStore walkStore,
                               ConflictDetector conflictDetector,
                               RecurrenceEngine recurrenceEngine,
                               Clock clock) {
        return new Scheduler(owner, petStore, taskStore, walkStore, conflictDetector, recurrenceEngine, clock);
    }
}
