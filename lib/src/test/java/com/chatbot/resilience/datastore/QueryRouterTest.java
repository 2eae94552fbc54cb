package com.chatbot.resilience.datastore;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryRouterTest {
    
    @Test
    void testPlainSelectIsReadOnly() {
        assertTrue(QueryRouter.isReadOnlyQuery("SELECT * FROM snipes WHERE channel_id = ?"));
        assertTrue(QueryRouter.isReadOnlyQuery("  select count(*) from user_data"));
    }
    
    @Test
    void testLockingSelectIsNotReadOnly() {
        assertFalse(QueryRouter.isReadOnlyQuery("SELECT * FROM user_data WHERE user_id = ? FOR UPDATE"));
        assertFalse(QueryRouter.isReadOnlyQuery("select * from user_data for share"));
    }
    
    @Test
    void testWritesAndCtesAreNotReadOnly() {
        assertFalse(QueryRouter.isReadOnlyQuery("INSERT INTO snipes (id) VALUES (?)"));
        assertFalse(QueryRouter.isReadOnlyQuery("UPDATE user_data SET xp = ?"));
        assertFalse(QueryRouter.isReadOnlyQuery("DELETE FROM snipes"));
        assertFalse(QueryRouter.isReadOnlyQuery("WITH moved AS (DELETE FROM snipes RETURNING *) SELECT * FROM moved"));
        assertFalse(QueryRouter.isReadOnlyQuery(null));
    }
    
    @Test
    void testRouting() {
        String select = "SELECT * FROM guild_settings WHERE guild_id = ?";
        
        assertEquals(QueryRouter.Target.REPLICA, QueryRouter.route(select, QueryOptions.defaults(), true));
        assertEquals(QueryRouter.Target.PRIMARY, QueryRouter.route(select, QueryOptions.defaults(), false));
        assertEquals(QueryRouter.Target.PRIMARY, QueryRouter.route(select, QueryOptions.primary(), true));
        assertEquals(QueryRouter.Target.PRIMARY,
            QueryRouter.route("UPDATE guild_settings SET prefix = ?", QueryOptions.defaults(), true));
    }
}
