package com.jumbo.companion.service.memory;

import com.jumbo.companion.model.MemoryKind;
import com.jumbo.companion.model.MemoryRecord;
import com.jumbo.companion.model.UserProfile;
import com.jumbo.companion.persistence.entity.MemoryEntity;
import com.jumbo.companion.persistence.entity.UserProfileEntity;
import com.jumbo.companion.persistence.repository.MemoryRepository;
import com.jumbo.companion.persistence.repository.UserProfileRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class JpaMemoryStoreTest {

    private static final OffsetDateTime BASE = OffsetDateTime.of(2026, 10, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    @Autowired
    private JpaMemoryStore memoryStore;

    @Autowired
    private JpaUserProfileStore profileStore;

    @Autowired
    private MemoryRepository memoryRepository;

    @Autowired
    private UserProfileRepository profileRepository;

    @AfterEach
    void cleanUp() {
        memoryRepository.deleteAll();
        profileRepository.deleteAll();
    }

    @Test
    void recentMemoriesAreNewestFirstAndLimited() {
        memoryRepository.saveAll(List.of(
                new MemoryEntity("u1", MemoryKind.FACT, "had a job interview", null, null, "anxiety", BASE),
                new MemoryEntity("u1", MemoryKind.CONVERSATION, "talked about exams", null, null, "anxiety", BASE.plusDays(1)),
                new MemoryEntity("u1", MemoryKind.PERSON, "Priya moved to Pune", "Priya", "friend", null, BASE.plusDays(2)),
                new MemoryEntity("u2", MemoryKind.FACT, "someone else's memory", null, null, null, BASE.plusDays(3))));

        List<MemoryRecord> recent = memoryStore.getRecentMemories("u1", 2);

        assertThat(recent).extracting(MemoryRecord::content)
                .containsExactly("Priya moved to Pune", "talked about exams");
        assertThat(recent.get(0).describesPerson()).isTrue();
        assertThat(recent.get(0).relationship()).isEqualTo("friend");
    }

    @Test
    void searchMatchesContentOrSubjectCaseInsensitively() {
        memoryRepository.saveAll(List.of(
                new MemoryEntity("u1", MemoryKind.PERSON, "Best friend since school", "Priya", "friend", null, BASE),
                new MemoryEntity("u1", MemoryKind.FACT, "Worried about the EXAM results", null, null, "anxiety", BASE.plusDays(1)),
                new MemoryEntity("u1", MemoryKind.FACT, "Went hiking", null, null, "happiness", BASE.plusDays(2)),
                new MemoryEntity("u2", MemoryKind.PERSON, "Priya from work", "Priya", "colleague", null, BASE)));

        List<MemoryRecord> found = memoryStore.searchMemories("u1", Set.of("priya", "exam"), 5);

        assertThat(found).extracting(MemoryRecord::content)
                .containsExactly("Worried about the EXAM results", "Best friend since school");
        assertThat(memoryStore.searchMemories("u1", Set.of(), 5)).isEmpty();
    }

    @Test
    void profileJsonIsParsed() {
        profileRepository.save(new UserProfileEntity("u1", "Sam",
                "{\"tone\":\"gentle\",\"checkins\":true}", "{\"Priya\":\"friend\",\"Arjun\":\"brother\"}"));

        UserProfile profile = profileStore.getPreferences("u1").orElseThrow();

        assertThat(profile.preferredName()).isEqualTo("Sam");
        assertThat(profile.preferences()).containsEntry("tone", "gentle").containsEntry("checkins", true);
        assertThat(profile.keyRelationships()).containsEntry("Priya", "friend").containsEntry("Arjun", "brother");
        assertThat(profileStore.getPreferences("missing")).isEmpty();
    }

    @Test
    void unreadableProfileJsonIsIgnored() {
        profileRepository.save(new UserProfileEntity("u1", "Sam", "{not json", null));

        UserProfile profile = profileStore.getPreferences("u1").orElseThrow();

        assertThat(profile.preferences()).isEmpty();
        assertThat(profile.keyRelationships()).isEmpty();
    }
}
