package com.openforge.memoria.session;

import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.domain.SessionStatus;
import com.openforge.memoria.repository.SdkSessionRepository;
import com.openforge.memoria.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import({SessionStore.class, SessionStoreTest.Config.class})
class SessionStoreTest {

    @TestConfiguration
    static class Config {
        @Bean
        MutableClock clock() {
            return new MutableClock(1_700_000_000_000L);
        }
    }

    @Autowired SessionStore store;
    @Autowired SdkSessionRepository repository;
    @Autowired MutableClock clock;

    @Test
    void findOrCreateIsIdempotentPerContentSession() {
        SdkSession first = store.findOrCreate("c-1", "memoria", "Fix bug");
        SdkSession again = store.findOrCreate("c-1", "other", "ignored");

        assertThat(again.getId()).isEqualTo(first.getId());
        assertThat(again.getProject()).isEqualTo("memoria");
        assertThat(first.getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(first.getStartedAtEpoch()).isEqualTo(clock.millis());
        assertThat(repository.count()).isEqualTo(1);
    }

    @Test
    void blankProjectBecomesUnknown() {
        assertThat(store.findOrCreate("c-1", " ", null).getProject()).isEqualTo("unknown");
    }

    @Test
    void eachPromptBumpsTheCounter() {
        store.registerPrompt("c-1", "memoria", "first");
        SdkSession second = store.registerPrompt("c-1", "memoria", "second");

        assertThat(second.getPromptCounter()).isEqualTo(2);
        assertThat(second.getUserPrompt()).isEqualTo("second");
    }

    @Test
    void memorySessionIdIsWriteOnce() {
        Long id = store.findOrCreate("c-1", "memoria", null).getId();

        assertThat(store.assignMemorySessionId(id, "sdk-1")).isEqualTo("sdk-1");
        assertThat(store.assignMemorySessionId(id, "gemini-c-1-99")).isEqualTo("sdk-1");
        assertThat(repository.findById(id).orElseThrow().getMemorySessionId()).isEqualTo("sdk-1");
    }

    @Test
    void completionOnlyAppliesToActiveSessions() {
        Long id = store.findOrCreate("c-1", "memoria", null).getId();

        assertThat(store.markCompleted(id)).isTrue();
        assertThat(store.markCompleted(id)).isFalse();
        assertThat(repository.findById(id).orElseThrow().getStatus()).isEqualTo(SessionStatus.COMPLETED);
    }

    @Test
    void staleSessionsAreFailedUnlessExcluded() {
        Long old = store.findOrCreate("old", "memoria", null).getId();
        Long busy = store.findOrCreate("busy", "memoria", null).getId();
        Long done = store.findOrCreate("done", "memoria", null).getId();
        store.markCompleted(done);
        clock.advance(Duration.ofHours(7));
        Long fresh = store.findOrCreate("fresh", "memoria", null).getId();

        List<Long> failed = store.failStaleSessions(Duration.ofHours(6), Set.of(busy));

        assertThat(failed).containsExactly(old);
        assertThat(repository.findById(old).orElseThrow().getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(repository.findById(busy).orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(repository.findById(done).orElseThrow().getStatus()).isEqualTo(SessionStatus.COMPLETED);
        assertThat(repository.findById(fresh).orElseThrow().getStatus()).isEqualTo(SessionStatus.ACTIVE);
    }
}
