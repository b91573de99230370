package com.ryuqq.userstore.adapter.inmemory.store;

import com.ryuqq.userstore.core.model.User;
import com.ryuqq.userstore.core.spi.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link UserRepository}.
 *
 * <p>Users are kept in a {@link ConcurrentHashMap} keyed by {@link User#id()}.
 * Nothing survives a process restart.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>users:</strong> ConcurrentHashMap&lt;Long, User&gt; - at most one user per id (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Asynchronous Lookup:</strong></p>
 * <ul>
 *   <li>{@link #getByIdAsync(long)} reads the map on a delayed executor</li>
 *   <li>The delay comes from {@link InMemoryUserRepositoryConfig#lookupDelayMs()}</li>
 *   <li>The read happens after the delay, so it observes writes made before completion</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryUserRepository repository = new InMemoryUserRepository();
 * repository.add(User.of(1L, "Ann", "ann@x.com"));
 *
 * repository.getById(1L);                 // Optional[User[id=1, ...]]
 * repository.getByIdAsync(1L).join();     // same, after 100ms
 * repository.searchByName("An");          // [User[id=1, ...]]
 * </pre>
 *
 * @author User Store Team
 * @since 1.0.0
 */
public class InMemoryUserRepository implements UserRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryUserRepository.class);

    private static final Comparator<User> BY_NAME_THEN_ID =
            Comparator.comparing(User::name).thenComparingLong(User::id);

    /**
     * User storage.
     * Key: user id, Value: User
     */
    private final ConcurrentHashMap<Long, User> users;

    private final InMemoryUserRepositoryConfig config;

    /**
     * Creates an empty repository with the default lookup delay.
     */
    public InMemoryUserRepository() {
        this(new InMemoryUserRepositoryConfig());
    }

    /**
     * Creates an empty repository.
     *
     * @param config repository configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryUserRepository(InMemoryUserRepositoryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.users = new ConcurrentHashMap<>();
        this.config = config;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<User> getById(long id) {
        return Optional.ofNullable(users.get(id));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Overwrites silently; the replaced user is only logged</li>
     * </ul>
     */
    @Override
    public void add(User entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }

        User previous = users.put(entity.id(), entity);
        if (previous != null) {
            log.debug("Overwrote user {}: {} -> {}", entity.id(), previous, entity);
        } else {
            log.debug("Added user {}", entity.id());
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int count() {
        return users.size();
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Scheduled with {@link CompletableFuture#delayedExecutor(long, TimeUnit)}</li>
     *   <li>Users are immutable, so the returned value is already an independent snapshot</li>
     * </ul>
     */
    @Override
    public CompletableFuture<Optional<User>> getByIdAsync(long id) {
        Executor delayed = CompletableFuture.delayedExecutor(config.lookupDelayMs(), TimeUnit.MILLISECONDS);
        log.debug("Async lookup for user {} scheduled in {}ms", id, config.lookupDelayMs());
        return CompletableFuture.supplyAsync(() -> getById(id), delayed);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<User> searchByName(String fragment) {
        if (fragment == null) {
            throw new IllegalArgumentException("fragment cannot be null");
        }

        return users.values().stream()
                .filter(user -> user.name().contains(fragment))
                .sorted(BY_NAME_THEN_ID)
                .collect(Collectors.toList());
    }

    /**
     * Returns the configuration this repository was created with.
     *
     * @return repository configuration
     */
    public InMemoryUserRepositoryConfig getConfig() {
        return config;
    }

    /**
     * Clears all stored users.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        users.clear();
    }
}
