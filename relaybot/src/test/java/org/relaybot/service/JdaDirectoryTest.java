package org.relaybot.service;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.relaybot.command.Membership;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdaDirectoryTest {

    private static final long HOME = 500L;
    private static final long USER = 42L;

    private JDA jda;
    private JdaDirectory directory;

    @BeforeEach
    void setUp() {
        jda = mock(JDA.class);
        directory = new JdaDirectory(jda, HOME);
    }

    @Test
    void shouldExposeHomeGuild() {
        assertEquals(HOME, directory.homeScopeId());
    }

    @Test
    void shouldMapCachedMember() {
        Guild guild = mock(Guild.class);
        when(guild.getIdLong()).thenReturn(HOME);
        Role role = mock(Role.class);
        when(role.getIdLong()).thenReturn(3L);
        Member member = mock(Member.class);
        when(member.getIdLong()).thenReturn(USER);
        when(member.getGuild()).thenReturn(guild);
        when(member.getRoles()).thenReturn(List.of(role));
        when(member.hasPermission(Permission.ADMINISTRATOR)).thenReturn(true);
        when(jda.getGuildById(HOME)).thenReturn(guild);
        when(guild.getMemberById(USER)).thenReturn(member);

        assertEquals(Optional.of(new Membership(USER, HOME, Set.of(3L), true)), directory.resolveMembership(USER, HOME));
    }

    @Test
    void shouldReturnEmptyForUnknownGuildOrMember() {
        assertFalse(directory.resolveMembership(USER, HOME).isPresent());

        Guild guild = mock(Guild.class);
        when(jda.getGuildById(HOME)).thenReturn(guild);
        assertFalse(directory.resolveMembership(USER, HOME).isPresent());
    }
}
