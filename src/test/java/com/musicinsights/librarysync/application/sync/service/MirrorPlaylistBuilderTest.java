package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.model.MirrorReport;
import com.musicinsights.librarysync.application.sync.model.SyncCancellation;
import com.musicinsights.librarysync.application.sync.remote.*;
import com.musicinsights.librarysync.support.FakeRemoteCatalog;
import com.musicinsights.librarysync.support.FakeRemoteCatalogConfig;
import com.musicinsights.librarysync.support.StoreTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.test.StepVerifier;

import java.util.List;

import static com.musicinsights.librarysync.support.FakeRemoteCatalog.track;
import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link MirrorPlaylistBuilder} 통합 테스트.
 *
 * <p>테스트 설정의 push chunk 크기는 2이다.</p>
 */
@SpringBootTest
@Import(FakeRemoteCatalogConfig.class)
@DisplayName("mirror playlist builder 테스트")
class MirrorPlaylistBuilderTest {

    private static final String MIRROR = "ytmb-all";

    @Autowired MirrorPlaylistBuilder builder;
    @Autowired LibraryReconciler reconciler;
    @Autowired FakeRemoteCatalog remote;
    @Autowired DatabaseClient db;

    @BeforeEach
    void setUp() {
        StoreTables.cleanAll(db);
        remote.reset();
    }

    private void seedStore(TrackRecord... tracks) {
        RemoteSnapshot snapshot = new RemoteSnapshot(
                List.of(new PlaylistContents(new PlaylistSnapshot("P1", "Mix"), List.of(tracks))),
                List.of(), List.of());
        reconciler.reconcile(snapshot, SyncCancellation.none()).block();
    }

    private static TrackRecord[] threeTracks() {
        return new TrackRecord[]{
                track("T1", "One", "AL1", "Album", "Alice"),
                track("T2", "Two", "AL1", "Album", "Alice"),
                track("T3", "Three", "AL1", "Album", "Alice")
        };
    }

    /**
     * 원격 미러가 없으면 만들고, 모든 트랙을 chunk 단위로 밀어 넣는지 검증한다.
     */
    @Test
    @DisplayName("원격 미러를 만들고 모든 트랙을 chunk 단위로 추가하는지 검증")
    void ensureMirror_createsRemoteAndPushesAll() {
        // given
        seedStore(threeTracks());

        // when / then
        StepVerifier.create(builder.ensureMirror(SyncCancellation.none()))
                .assertNext(r -> {
                    assertEquals(3L, r.added());
                    assertEquals(0L, r.alreadyPresent());
                    assertTrue(r.remoteCreated());
                })
                .verifyComplete();

        String mirrorId = remote.remoteIdOfTitle(MIRROR);
        assertNotNull(mirrorId);
        assertEquals(1, remote.createCalls.get());
        assertEquals(2, remote.addCalls.get());
        assertEquals(List.of("T1", "T2", "T3"), remote.trackIdsOf(mirrorId));
        assertEquals(List.of("T1", "T2", "T3"), StoreTables.trackIdsOf(db, mirrorId));
    }

    /**
     * 이미 모든 트랙이 미러에 있으면 원격 쓰기를 하지 않는다.
     */
    @Test
    @DisplayName("변경이 없으면 두 번째 실행은 원격 쓰기를 하지 않는지 검증")
    void ensureMirror_secondRun_writesNothing() {
        // given
        seedStore(threeTracks());
        builder.ensureMirror(SyncCancellation.none()).block();

        // when
        MirrorReport second = builder.ensureMirror(SyncCancellation.none()).block();

        // then
        assertNotNull(second);
        assertEquals(0L, second.added());
        assertEquals(3L, second.alreadyPresent());
        assertFalse(second.remoteCreated());
        assertEquals(1, remote.createCalls.get());
        assertEquals(2, remote.addCalls.get());
    }

    /**
     * 새 트랙은 기존 미러 끝에 이어서 연결된다.
     */
    @Test
    @DisplayName("새로 생긴 트랙만 미러 끝에 추가되는지 검증")
    void ensureMirror_appendsOnlyNewTracks() {
        // given
        seedStore(threeTracks());
        builder.ensureMirror(SyncCancellation.none()).block();

        TrackRecord[] four = new TrackRecord[]{
                threeTracks()[0], threeTracks()[1], threeTracks()[2],
                track("T4", "Four", "AL1", "Album", "Alice")
        };
        seedStore(four);

        // when
        MirrorReport report = builder.ensureMirror(SyncCancellation.none()).block();

        // then
        assertNotNull(report);
        assertEquals(1L, report.added());
        assertEquals(3L, report.alreadyPresent());

        String mirrorId = remote.remoteIdOfTitle(MIRROR);
        assertEquals(List.of("T1", "T2", "T3", "T4"), StoreTables.trackIdsOf(db, mirrorId));
        assertEquals(List.of("T1", "T2", "T3", "T4"), remote.trackIdsOf(mirrorId));
    }

    /**
     * 원격 미러가 사라지면 새로 만들고 로컬 미러 행을 새 원격 id로 옮긴다.
     */
    @Test
    @DisplayName("원격 미러가 사라지면 다시 만들고 로컬 행을 새 id로 옮겨 전부 다시 추가하는지 검증")
    void ensureMirror_remoteRecreated_rebindsLocalRow() {
        // given
        seedStore(threeTracks());
        builder.ensureMirror(SyncCancellation.none()).block();
        String oldId = remote.remoteIdOfTitle(MIRROR);
        remote.removePlaylist(oldId);

        // when
        MirrorReport report = builder.ensureMirror(SyncCancellation.none()).block();

        // then
        assertNotNull(report);
        assertTrue(report.remoteCreated());
        assertEquals(3L, report.added());
        assertNotEquals(oldId, report.remoteId());

        assertEquals(2L, StoreTables.count(db, "playlist"));
        assertTrue(StoreTables.trackIdsOf(db, oldId).isEmpty());
        assertEquals(List.of("T1", "T2", "T3"), StoreTables.trackIdsOf(db, report.remoteId()));
    }

    /**
     * 원격 추가가 실패하면 그 chunk는 로컬에 연결되지 않는다.
     */
    @Test
    @DisplayName("원격 추가 실패 시 에러가 전파되고 로컬 미러에 연결되지 않는지 검증")
    void ensureMirror_addFailure_linksNothing() {
        // given
        seedStore(threeTracks());
        remote.failAddWith(new RemoteCatalogException("quota exceeded", false));

        // when / then
        StepVerifier.create(builder.ensureMirror(SyncCancellation.none()))
                .expectError(RemoteCatalogException.class)
                .verify();

        String mirrorId = remote.remoteIdOfTitle(MIRROR);
        assertTrue(StoreTables.trackIdsOf(db, mirrorId).isEmpty());
    }

    /**
     * 취소가 요청되면 다음 chunk부터 보내지 않고, 이미 보낸 chunk의 연결은 남긴다.
     */
    @Test
    @DisplayName("취소 요청 후에는 남은 chunk를 보내지 않고 다음 실행에서 이어 추가하는지 검증")
    void ensureMirror_cancelled_stopsBetweenChunks() {
        // given
        seedStore(threeTracks());
        SyncCancellation cancellation = new SyncCancellation();
        remote.afterEachAdd(cancellation::request);

        // when
        MirrorReport report = builder.ensureMirror(cancellation).block();

        // then
        assertNotNull(report);
        assertEquals(2L, report.added());
        assertEquals(1, remote.addCalls.get());

        String mirrorId = remote.remoteIdOfTitle(MIRROR);
        assertEquals(List.of("T1", "T2"), remote.trackIdsOf(mirrorId));
        assertEquals(List.of("T1", "T2"), StoreTables.trackIdsOf(db, mirrorId));

        // when: 다음 실행
        remote.afterEachAdd(null);
        MirrorReport next = builder.ensureMirror(SyncCancellation.none()).block();

        // then
        assertNotNull(next);
        assertEquals(1L, next.added());
        assertEquals(2L, next.alreadyPresent());
        assertEquals(List.of("T1", "T2", "T3"), StoreTables.trackIdsOf(db, mirrorId));
    }

    /**
     * 미러에만 남은 트랙은 다음 reconcile에서 정리되고, 미러 플레이리스트 자체는 유지된다.
     */
    @Test
    @DisplayName("미러에만 남은 트랙은 정리되고 미러 플레이리스트는 유지되는지 검증")
    void reconcile_afterMirror_prunesMirrorOnlyTracks() {
        // given
        seedStore(threeTracks());
        builder.ensureMirror(SyncCancellation.none()).block();
        String mirrorId = remote.remoteIdOfTitle(MIRROR);

        // when
        seedStore(threeTracks()[0]);

        // then
        assertEquals(1L, StoreTables.count(db, "track"));
        assertEquals(List.of("T1"), StoreTables.trackIdsOf(db, mirrorId));
        assertEquals(2L, StoreTables.count(db, "playlist"));
    }
}
