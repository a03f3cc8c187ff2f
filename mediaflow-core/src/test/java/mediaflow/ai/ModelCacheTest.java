package mediaflow.ai;

import mediaflow.error.FailureKind;
import mediaflow.error.InferenceException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelCacheTest {

    private static ModelConfig named(String model) {
        return new ModelConfig(model, 0.9, 1, 0.95, 1024, null);
    }

    @Test
    void reusesHandleForEqualConfig() throws InferenceException {
        ModelCache<Object> cache = new ModelCache<>(2);
        AtomicInteger created = new AtomicInteger();

        Object first = cache.getOrCreate(named("a"), config -> new Object[]{created.incrementAndGet()});
        Object second = cache.getOrCreate(named("a"), config -> new Object[]{created.incrementAndGet()});

        assertSame(first, second);
        assertEquals(1, created.get());
        assertEquals(1, cache.hits());
        assertEquals(1, cache.misses());
    }

    @Test
    void evictsLeastRecentlyUsed() throws InferenceException {
        ModelCache<String> cache = new ModelCache<>(2);
        cache.getOrCreate(named("a"), ModelConfig::model);
        cache.getOrCreate(named("b"), ModelConfig::model);
        cache.getOrCreate(named("a"), ModelConfig::model);
        cache.getOrCreate(named("c"), ModelConfig::model);

        assertEquals(2, cache.size());
        assertTrue(cache.contains(named("a")));
        assertFalse(cache.contains(named("b")));
    }

    @Test
    void factoryFailureIsNotCached() {
        ModelCache<String> cache = new ModelCache<>(2);

        assertThrows(InferenceException.class, () -> cache.getOrCreate(named("a"), config -> {
            throw new InferenceException(FailureKind.GENERAL, "no model");
        }));
        assertEquals(0, cache.size());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new ModelCache<String>(0));
    }
}
