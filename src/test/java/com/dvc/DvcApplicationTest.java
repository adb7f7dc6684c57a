package com.dvc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DvcApplicationTest {

    @Test
    @DisplayName("serve as the subcommand starts the server")
    void serveSubcommand() {
        assertTrue(DvcApplication.isServeMode("serve"));
        assertTrue(DvcApplication.isServeMode("serve", "--server.port=9090"));
    }

    @Test
    @DisplayName("serve anywhere else is a plain argument")
    void serveAsArgument() {
        assertFalse(DvcApplication.isServeMode("spawn", "serve"));
        assertFalse(DvcApplication.isServeMode("submit", "abc", "serve"));
        assertFalse(DvcApplication.isServeMode("--help"));
        assertFalse(DvcApplication.isServeMode());
    }
}
