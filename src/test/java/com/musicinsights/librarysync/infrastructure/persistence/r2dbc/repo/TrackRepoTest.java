package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.TrackRef;
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
 * {@link TrackRepo} 통합 테스트.
 *
 * <p>external_id 유일성, 미러 제외 조회, orphan 판정을 검증한다.</p>
 */
@SpringBootTest
@DisplayName("track repo 테스트")
class TrackRepoTest {

    private static final String MIRROR = "ytmb-all";

    @Autowired TrackRepo repo;
    @Autowired AlbumRepo albumRepo;
    @Autowired PlaylistRepo playlistRepo;
    @Autowired PlaylistTrackRepo playlistTrackRepo;
    @Autowired DatabaseClient db;

    private long albumId;

    @BeforeEach
    void clean() {
        StoreTables.cleanAll(db);
        albumId = albumRepo.getOrCreate(new StoreSeeds.AlbumSeed("ext:al", "Album")).block().row().id();
    }

    private long track(String ext) {
        return repo.getOrCreate(new StoreSeeds.TrackSeed(ext, "Song " + ext, null, List.of()), albumId)
                .block().row().id();
    }

    /**
     * 같은 external_id는 다른 제목으로 다시 들어와도 같은 행으로 해석되는지 검증한다.
     */
    @Test
    @DisplayName("external_id가 같으면 같은 트랙 행으로 해석되는지 검증")
    void getOrCreate_sameExternalId_resolvesToExistingRow() {
        long id = track("T1");

        StepVerifier.create(repo.getOrCreate(new StoreSeeds.TrackSeed("T1", "Renamed", null, List.of()), albumId))
                .assertNext(s -> {
                    Assertions.assertFalse(s.created());
                    Assertions.assertEquals(id, s.row().id());
                    Assertions.assertEquals("Song T1", s.row().name());
                })
                .verifyComplete();

        Assertions.assertEquals(1L, StoreTables.count(db, "track"));
    }

    /**
     * update가 제목과 앨범을 덮어쓰는지 검증한다.
     */
    @Test
    @DisplayName("update가 제목과 앨범을 덮어쓰는지 검증")
    void update_overwritesNameAndAlbum() {
        long id = track("T1");
        long other = albumRepo.getOrCreate(new StoreSeeds.AlbumSeed("ext:other", "Other")).block().row().id();

        StepVerifier.create(repo.update(id, "New", other)).expectNext(1L).verifyComplete();
        StepVerifier.create(repo.findByExternalId("T1"))
                .assertNext(row -> {
                    Assertions.assertEquals("New", row.name());
                    Assertions.assertEquals(other, row.albumId());
                })
                .verifyComplete();
    }

    /**
     * 플레이리스트에 아직 없는 트랙만 id 순으로 조회되는지 검증한다.
     */
    @Test
    @DisplayName("플레이리스트에 연결되지 않은 트랙만 id 순으로 조회되는지 검증")
    void findNotInPlaylist_returnsMissingInIdOrder() {
        long t1 = track("T1");
        long t2 = track("T2");
        long t3 = track("T3");
        long mirror = playlistRepo.getOrCreate("M", MIRROR).block().row().id();
        playlistTrackRepo.link(mirror, t2, 0).block();

        StepVerifier.create(repo.findNotInPlaylist(mirror).collectList())
                .expectNext(List.of(new TrackRef(t1, "T1"), new TrackRef(t3, "T3")))
                .verifyComplete();
    }

    /**
     * 미러 플레이리스트 연결은 참조로 치지 않고, 저장 앨범 소속이면 orphan이 아닌지 검증한다.
     */
    @Test
    @DisplayName("미러 연결만 있는 트랙은 orphan, 일반 플레이리스트/저장 앨범 소속은 제외되는지 검증")
    void findOrphanIds_ignoresMirrorLinks() {
        long inPlaylist = track("T1");
        long onlyMirror = track("T2");

        long pl = playlistRepo.getOrCreate("P1", "Road Trip").block().row().id();
        long mirror = playlistRepo.getOrCreate("M", MIRROR).block().row().id();
        playlistTrackRepo.link(pl, inPlaylist, 0).block();
        playlistTrackRepo.link(mirror, inPlaylist, 0).block();
        playlistTrackRepo.link(mirror, onlyMirror, 1).block();

        StepVerifier.create(repo.findOrphanIds(MIRROR).collectList())
                .expectNext(List.of(onlyMirror))
                .verifyComplete();

        albumRepo.markSaved(albumId).block();
        StepVerifier.create(repo.findOrphanIds(MIRROR).collectList())
                .expectNext(List.of())
                .verifyComplete();
    }
}
