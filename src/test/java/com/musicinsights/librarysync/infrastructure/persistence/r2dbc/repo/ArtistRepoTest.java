package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.mapper.NormalizeUtils;
import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.support.StoreTables;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.util.List;

/**
 * {@link ArtistRepo} 통합 테스트.
 *
 * <p>artist_key 기반 get-or-create, 저장 플래그 토글, orphan 조회를 검증한다.</p>
 */
@SpringBootTest
@DisplayName("artist repo 테스트")
class ArtistRepoTest {

    @Autowired
    ArtistRepo repo;

    @Autowired
    DatabaseClient db;

    @BeforeEach
    void clean() {
        StoreTables.cleanAll(db);
    }

    /**
     * 같은 key로 두 번 get-or-create 하면 첫 번째만 생성되고 같은 id를 돌려주는지 검증한다.
     */
    @Test
    @DisplayName("동일 key로 get-or-create를 반복해도 row가 1개이고 같은 id를 반환하는지 검증")
    void getOrCreate_isIdempotent() {
        StoreSeeds.ArtistSeed seed = new StoreSeeds.ArtistSeed(NormalizeUtils.artistKey("ar-1", "IU"), "IU");

        Long[] firstId = new Long[1];
        StepVerifier.create(repo.getOrCreate(seed))
                .assertNext(stored -> {
                    Assertions.assertTrue(stored.created());
                    Assertions.assertEquals("IU", stored.row().name());
                    Assertions.assertFalse(stored.row().userSaved());
                    firstId[0] = stored.row().id();
                })
                .verifyComplete();

        StepVerifier.create(repo.getOrCreate(new StoreSeeds.ArtistSeed(seed.key(), "iu")))
                .assertNext(stored -> {
                    Assertions.assertFalse(stored.created());
                    Assertions.assertEquals(firstId[0], stored.row().id());
                })
                .verifyComplete();

        Assertions.assertEquals(1L, StoreTables.count(db, "artist"));
    }

    /**
     * markSaved는 실제로 바뀐 경우에만 1을 반환하고, clearSavedExcept는 keep 목록 밖만 끄는지 검증한다.
     */
    @Test
    @DisplayName("markSaved/clearSavedExcept가 바뀐 행 수만 반환하는지 검증")
    void markSaved_and_clearSavedExcept() {
        Long a = repo.getOrCreate(new StoreSeeds.ArtistSeed("ext:a", "A")).block().row().id();
        Long b = repo.getOrCreate(new StoreSeeds.ArtistSeed("ext:b", "B")).block().row().id();

        StepVerifier.create(repo.markSaved(a)).expectNext(1L).verifyComplete();
        StepVerifier.create(repo.markSaved(a)).expectNext(0L).verifyComplete();
        StepVerifier.create(repo.markSaved(b)).expectNext(1L).verifyComplete();

        StepVerifier.create(repo.clearSavedExcept(List.of(a))).expectNext(1L).verifyComplete();
        StepVerifier.create(repo.findByKey("ext:b"))
                .assertNext(row -> Assertions.assertFalse(row.userSaved()))
                .verifyComplete();

        StepVerifier.create(repo.clearSavedExcept(List.of())).expectNext(1L).verifyComplete();
        StepVerifier.create(repo.findByKey("ext:a"))
                .assertNext(row -> Assertions.assertFalse(row.userSaved()))
                .verifyComplete();
    }

    /**
     * 저장되지 않았고 트랙과 연결되지 않은 아티스트만 orphan으로 조회되는지 검증한다.
     */
    @Test
    @DisplayName("저장되지 않고 연결도 없는 아티스트만 orphan으로 조회되는지 검증")
    void findOrphanIds_returnsUnsavedUnlinkedOnly() {
        Long saved = repo.getOrCreate(new StoreSeeds.ArtistSeed("ext:saved", "Saved")).block().row().id();
        repo.markSaved(saved).block();
        Long lonely = repo.getOrCreate(new StoreSeeds.ArtistSeed("ext:lonely", "Lonely")).block().row().id();

        StepVerifier.create(repo.findOrphanIds().collectList())
                .expectNext(List.of(lonely))
                .verifyComplete();

        StepVerifier.create(repo.deleteByIds(List.of(lonely))).expectNext(1L).verifyComplete();
        Assertions.assertEquals(1L, StoreTables.count(db, "artist"));
    }
}
