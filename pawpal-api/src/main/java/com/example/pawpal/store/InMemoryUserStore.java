package com.example.pawpal.store;

import com.example.pawpal.model.User;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryUserStore {

    private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();

    public void save(User user) {
        users.put(user.getUserId(), user);
    }

    public Optional<User> findById(String userId) {
        return Optional.ofNullable(users.get(userId));
    }
}
