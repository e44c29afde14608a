package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.remote.*;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import com.musicinsights.librarysync.support.FakeRemoteCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static com.musicinsights.librarysync.support.FakeRemoteCatalog.track;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * {@link RemoteSnapshotFetcher} 단위 테스트.
 */
@DisplayName("remote snapshot fetcher 테스트")
class RemoteSnapshotFetcherTest {

    private static LibrarySyncProperties props() {
        return new LibrarySyncProperties(
                new LibrarySyncProperties.Mirror(true, "ytmb-all", 50),
                new LibrarySyncProperties.Remote(Duration.ofSeconds(1), 0, Duration.ofMillis(1), 3),
                new LibrarySyncProperties.Export("unused"));
    }

    private static RemoteSnapshotFetcher fetcher(RemoteCatalog remote) {
        return new RemoteSnapshotFetcher(remote, new RemoteCallPolicy(props()), props());
    }

    /**
     * 병렬 조회여도 원격 순서가 유지되고 미러 플레이리스트는 빠지는지 검증한다.
     */
    @Test
    @DisplayName("플레이리스트 순서가 유지되고 미러 플레이리스트는 제외되는지 검증")
    void fetch_keepsOrder_excludesMirror() {
        // given
        FakeRemoteCatalog remote = new FakeRemoteCatalog()
                .playlist("P1", "First", track("T1", "One", null, null))
                .playlist("M", "ytmb-all", track("T1", "One", null, null))
                .playlist("P2", "Second", track("T2", "Two", null, null), track("T3", "Three", null, null))
                .playlist("P3", "Third")
                .savedArtist(new ArtistRef("ar-Zed", "Zed"));

        // when / then
        StepVerifier.create(fetcher(remote).fetch())
                .assertNext(s -> {
                    assertEquals(List.of("P1", "P2", "P3"),
                            s.playlists().stream().map(p -> p.playlist().remoteId()).toList());
                    assertEquals(2, s.playlists().get(1).tracks().size());
                    assertTrue(s.playlists().get(2).tracks().isEmpty());
                    assertEquals(1, s.savedArtists().size());
                    assertTrue(s.savedAlbums().isEmpty());
                })
                .verifyComplete();
    }

    /**
     * 원격 id가 없는 플레이리스트는 트랙 조회 없이 헤더만 넘긴다.
     */
    @Test
    @DisplayName("원격 id가 없는 플레이리스트는 트랙 조회 없이 빈 내용으로 넘어가는지 검증")
    void fetch_playlistWithoutId_skipsTrackFetch() {
        // given
        RemoteCatalog remote = mock(RemoteCatalog.class);
        when(remote.fetchPlaylists()).thenReturn(Flux.just(new PlaylistSnapshot(null, "Broken")));
        when(remote.fetchAlbums()).thenReturn(Flux.empty());
        when(remote.fetchArtists()).thenReturn(Flux.empty());

        // when / then
        StepVerifier.create(fetcher(remote).fetch())
                .assertNext(s -> {
                    assertEquals(1, s.playlists().size());
                    assertTrue(s.playlists().get(0).tracks().isEmpty());
                })
                .verifyComplete();

        verify(remote, never()).fetchPlaylistTracks(any());
    }

    /**
     * 읽기 중 하나라도 실패하면 snapshot 전체가 실패한다.
     */
    @Test
    @DisplayName("원격 읽기가 실패하면 snapshot 전체가 실패하는지 검증")
    void fetch_failure_failsWholeSnapshot() {
        // given
        FakeRemoteCatalog remote = new FakeRemoteCatalog().playlist("P1", "First");
        remote.failFetchWith(new RemoteCatalogException("unauthorized", false));

        // when / then
        StepVerifier.create(fetcher(remote).fetch())
                .expectError(RemoteCatalogException.class)
                .verify();
    }
}
