package org.relaybot;

import org.relaybot.command.ActorProfile;
import org.relaybot.command.permission.PermissionLevel;
import org.relaybot.service.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite storage of user profiles. Read errors are logged and answered with the empty profile.
 */
public class DatabaseManager implements ProfileStore {

    private static final Logger log = LoggerFactory.getLogger(DatabaseManager.class);

    private final String url;

    public DatabaseManager(String url) {
        this.url = url;
        createTables();
    }

    private Connection connect() throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(5000);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        return DriverManager.getConnection(url, config.toProperties());
    }

    private void createTables() {
        String sqlProfiles = "CREATE TABLE IF NOT EXISTS profiles (" +
                "discord_id TEXT PRIMARY KEY, " +
                "granted_level TEXT NOT NULL DEFAULT 'NONE', " +
                "blacklisted INTEGER NOT NULL DEFAULT 0" +
                ");";

        try (Connection conn = this.connect();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sqlProfiles);
        } catch (SQLException e) {
            throw new IllegalStateException("Initialisation de la base impossible : " + url, e);
        }
    }

    @Override
    public ActorProfile getProfile(long actorId) {
        String sql = "SELECT granted_level, blacklisted FROM profiles WHERE discord_id = ?";
        try (Connection conn = this.connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, Long.toString(actorId));
            try (ResultSet rs = pstmt.executeQuery()) {
                if (rs.next()) {
                    return new ActorProfile(actorId, parseLevel(rs.getString("granted_level")), rs.getInt("blacklisted") != 0);
                }
            }
        } catch (SQLException e) {
            log.warn("Erreur lecture profil {} : {}", actorId, e.getMessage());
        }
        return ActorProfile.empty(actorId);
    }

    public synchronized void saveProfile(ActorProfile profile) {
        String sql = "INSERT OR REPLACE INTO profiles(discord_id, granted_level, blacklisted) VALUES(?, ?, ?)";
        try (Connection conn = this.connect();
             PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, Long.toString(profile.actorId()));
            pstmt.setString(2, profile.grantedLevel().name());
            pstmt.setInt(3, profile.blacklisted() ? 1 : 0);
            pstmt.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Erreur sauvegarde profil " + profile.actorId(), e);
        }
    }

    private static PermissionLevel parseLevel(String value) {
        if (value == null) return PermissionLevel.NONE;
        try {
            return PermissionLevel.valueOf(value.toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Niveau de permission inconnu en base : {}", value);
            return PermissionLevel.NONE;
        }
    }
}
