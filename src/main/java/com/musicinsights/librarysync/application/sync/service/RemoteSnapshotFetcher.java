package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.remote.*;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Fetching 단계: 원격 라이브러리 전체를 읽어 하나의 {@link RemoteSnapshot}으로 만든다.
 * <p>
 * 플레이리스트별 트랙 조회는 fetch-concurrency만큼 병렬로 수행하되 결과는 원격 순서를 유지한다.
 * 미러 플레이리스트는 snapshot에 넣지 않는다.
 */
@Component
public class RemoteSnapshotFetcher {
    private static final Logger log = LoggerFactory.getLogger(RemoteSnapshotFetcher.class);

    private final RemoteCatalog remote;
    private final RemoteCallPolicy policy;
    private final String mirrorTitle;
    private final int concurrency;

    public RemoteSnapshotFetcher(RemoteCatalog remote, RemoteCallPolicy policy, LibrarySyncProperties props) {
        this.remote = remote;
        this.policy = policy;
        this.mirrorTitle = props.mirror().title();
        this.concurrency = Math.max(1, props.remote().fetchConcurrency());
    }

    /**
     * 원격 snapshot을 읽는다. 어느 하나라도 실패하면 전체가 실패한다.
     *
     * @return 완성된 snapshot
     */
    public Mono<RemoteSnapshot> fetch() {
        Mono<List<PlaylistContents>> playlists = policy
                .call(() -> remote.fetchPlaylists().collectList(), "fetchPlaylists")
                .flatMapMany(Flux::fromIterable)
                .filter(p -> !Objects.equals(mirrorTitle, p.title()))
                .flatMapSequential(this::fetchContents, concurrency)
                .collectList();

        Mono<List<AlbumSnapshot>> albums =
                policy.call(() -> remote.fetchAlbums().collectList(), "fetchAlbums");

        Mono<List<ArtistRef>> artists =
                policy.call(() -> remote.fetchArtists().collectList(), "fetchArtists");

        return Mono.zip(playlists, albums, artists)
                .map(t -> new RemoteSnapshot(t.getT1(), t.getT2(), t.getT3()))
                .doOnNext(s -> log.info("fetched snapshot: playlists={}, savedAlbums={}, savedArtists={}",
                        s.playlists().size(), s.savedAlbums().size(), s.savedArtists().size()));
    }

    private Mono<PlaylistContents> fetchContents(PlaylistSnapshot playlist) {
        if (playlist.remoteId() == null) {
            // 헤더만 넘기고 reconcile에서 malformed로 기록
            return Mono.just(new PlaylistContents(playlist, List.of()));
        }
        return policy.call(() -> remote.fetchPlaylistTracks(playlist.remoteId()).collectList(),
                        "fetchPlaylistTracks " + playlist.remoteId())
                .map(tracks -> new PlaylistContents(playlist, tracks));
    }
}
