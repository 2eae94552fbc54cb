package com.chatbot.resilience.datastore;

import java.util.Collection;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validation for identifiers that are interpolated into SQL text. Values are always
 * bound as parameters; only table and column names pass through here.
 */
public final class SqlIdentifiers {
    
    /**
     * Tables the data store may write to.
     */
    public static final Set<String> ALLOWED_TABLES = Set.of(
        "guild_settings",
        "moderation_logs",
        "user_data",
        "guild_user_data",
        "user_afk",
        "snipes",
        "playlists",
        "bot_stats",
        "command_analytics",
        "nhentai_favourites",
        "anime_favourites",
        "anime_notifications",
        "automod_settings",
        "mod_log_settings",
        "mod_infractions",
        "word_filters",
        "warn_thresholds",
        "raid_mode",
        "user_music_preferences",
        "user_music_favorites",
        "user_music_history"
    );
    
    private static final Pattern VALID_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    
    private SqlIdentifiers() {
    }
    
    public static String validateTable(String table) {
        if (table == null || !ALLOWED_TABLES.contains(table)) {
            throw new DataStoreException.InvalidIdentifierException(table, "Table not in whitelist.");
        }
        return table;
    }
    
    public static String validateIdentifier(String identifier) {
        if (identifier == null || !VALID_IDENTIFIER.matcher(identifier).matches()) {
            throw new DataStoreException.InvalidIdentifierException(identifier,
                "Only alphanumeric and underscore allowed.");
        }
        return identifier;
    }
    
    public static void validateIdentifiers(Collection<String> identifiers) {
        identifiers.forEach(SqlIdentifiers::validateIdentifier);
    }
    
    public static boolean isAllowedTable(String table) {
        return ALLOWED_TABLES.contains(table);
    }
}
