package com.parallax.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setItem puts session, item and task kind")
    void setItem() {
        MdcContext.setItem("PLX-1", 2, "CODE");

        assertEquals("PLX-1", MDC.get("sessionId"));
        assertEquals("2", MDC.get("itemIndex"));
        assertEquals("CODE", MDC.get("taskKind"));
    }

    @Test
    @DisplayName("clear removes every Parallax key but leaves others")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setLevel("PLX-1", 3);
        MdcContext.setItem("PLX-1", 0, "CODE");

        MdcContext.clear();

        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("levelNumber"));
        assertNull(MDC.get("itemIndex"));
        assertEquals("kept", MDC.get("other"));
    }
}
