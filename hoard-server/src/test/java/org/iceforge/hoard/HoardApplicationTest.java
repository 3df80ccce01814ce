package org.iceforge.hoard;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HoardApplicationTest {

    @Test
    void optionsAlone_startTheServer() {
        assertFalse(HoardApplication.hasCommand(new String[0]));
        assertFalse(HoardApplication.hasCommand(new String[]{"--server.port=9090"}));
    }

    @Test
    void positionalArgument_runsCommand() {
        assertTrue(HoardApplication.hasCommand(new String[]{"stats"}));
        assertTrue(HoardApplication.hasCommand(new String[]{"--hoard.cache.ttl=1h", "clear-expired"}));
    }
}
