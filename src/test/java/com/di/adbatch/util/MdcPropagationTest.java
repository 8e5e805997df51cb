package com.di.adbatch.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    @DisplayName("Wrapped tasks see the submitter's MDC on a pool thread")
    void testWrapCallable() throws Exception {
        MDC.put(MdcPropagation.SESSION_ID, "s1");
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            String seen = pool.submit(MdcPropagation.wrapCallable(() -> MDC.get(MdcPropagation.SESSION_ID))).get();
            String after = pool.submit(() -> MDC.get(MdcPropagation.SESSION_ID)).get();

            assertEquals("s1", seen);
            assertNull(after, "context is cleared once the task is done");
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Explicit context is set for the call and removed afterwards")
    void testCallWithMdcContext() throws Exception {
        String inside = MdcPropagation.callWithMdcContext(Map.of(MdcPropagation.WORKER, "1"),
                () -> MDC.get(MdcPropagation.WORKER));

        assertEquals("1", inside);
        assertNull(MDC.get(MdcPropagation.WORKER));
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }
}
