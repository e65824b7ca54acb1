package com.askus.backend;

import com.askus.backend.support.RoutingFakes.FixedStore;
import com.askus.backend.util.ExternalCallException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RouterStartupCheckTest {

    @Test
    void existingCollection_passes() {
        assertDoesNotThrow(() -> RouterStartupCheck.verifyCollection(new FixedStore(List.of()), "AgentPrototypes"));
    }

    @Test
    void missingCollection_stopsStartup() {
        FixedStore missing = new FixedStore(List.of()) {
            @Override
            public boolean collectionExists() {
                return false;
            }
        };

        assertThrows(IllegalStateException.class, () -> RouterStartupCheck.verifyCollection(missing, "AgentPrototypes"));
    }

    @Test
    void unreachableStore_stopsStartup() {
        FixedStore unreachable = new FixedStore(List.of()) {
            @Override
            public boolean collectionExists() {
                throw new ExternalCallException("vector-store", "connection refused");
            }
        };

        assertThrows(IllegalStateException.class, () -> RouterStartupCheck.verifyCollection(unreachable, "AgentPrototypes"));
    }
}
