package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.model.MirrorReport;
import com.musicinsights.librarysync.application.sync.model.SyncCancellation;
import com.musicinsights.librarysync.application.sync.remote.RemoteCatalog;
import com.musicinsights.librarysync.application.sync.store.EntityStore;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.TrackRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * store의 모든 트랙을 담는 미러 플레이리스트를 로컬과 원격에 유지하는 서비스입니다.
 * <p>
 * 원격 쪽은 추가만 합니다(additive-only). 원격 쓰기 연산을 호출하는 곳은 이 클래스뿐입니다.
 * <p>
 * 흐름: 원격 미러 찾기/생성 → 로컬 행 바인딩 → 미러에 없는 트랙 계산 → chunk 단위 push 후 로컬 연결
 * <p>
 * 취소는 chunk 사이에서 확인하며, 이미 보낸 chunk의 연결은 남긴다.
 */
@Service
public class MirrorPlaylistBuilder {
    private static final Logger log = LoggerFactory.getLogger(MirrorPlaylistBuilder.class);

    private final EntityStore store;
    private final RemoteCatalog remote;
    private final RemoteCallPolicy policy;
    private final String title;
    private final int chunkSize;

    public MirrorPlaylistBuilder(
            EntityStore store,
            RemoteCatalog remote,
            RemoteCallPolicy policy,
            LibrarySyncProperties props
    ) {
        this.store = store;
        this.remote = remote;
        this.policy = policy;
        this.title = props.mirror().title();
        this.chunkSize = Math.max(1, props.mirror().pushChunkSize());
    }

    private record RemoteMirror(String remoteId, boolean created) {}

    /**
     * 미러 플레이리스트가 store의 트랙 전체를 담도록 맞춥니다.
     * <p>
     * 변경이 없으면 원격 쓰기 호출을 하지 않습니다.
     *
     * @param cancellation 실행 취소 플래그(다음 chunk를 보내기 전에 확인)
     * @return 미러 결과
     */
    public Mono<MirrorReport> ensureMirror(SyncCancellation cancellation) {
        return resolveRemote()
                .flatMap(rm -> bindLocal(rm.remoteId())
                        .flatMap(playlistId -> store.playlistTrack.countByPlaylist(playlistId)
                                .flatMap(present -> pushMissing(playlistId, rm.remoteId(), cancellation)
                                        .map(added -> new MirrorReport(added, present, rm.created(), rm.remoteId())))))
                .doOnNext(r -> log.info("mirror '{}' ({}): added={}, alreadyPresent={}, remoteCreated={}",
                        title, r.remoteId(), r.added(), r.alreadyPresent(), r.remoteCreated()));
    }

    /** 원격에서 예약 제목의 플레이리스트를 찾고, 없으면 만든다. */
    private Mono<RemoteMirror> resolveRemote() {
        return policy.call(() -> remote.fetchPlaylists()
                                .filter(p -> Objects.equals(title, p.title()) && p.remoteId() != null)
                                .next(),
                        "findMirror")
                .map(p -> new RemoteMirror(p.remoteId(), false))
                .switchIfEmpty(Mono.defer(() -> policy.call(() -> remote.createPlaylist(title), "createPlaylist")
                        .doOnNext(id -> log.info("created remote mirror playlist '{}' ({})", title, id))
                        .map(id -> new RemoteMirror(id, true))));
    }

    /**
     * 원격 id에 맞는 로컬 미러 행을 확보한다.
     * <p>
     * 제목으로 찾은 기존 행의 원격 id가 다르면(원격 미러가 다시 만들어진 경우) 행을 새 id로 옮기고
     * 이전 연결을 모두 버려 다시 push되게 한다.
     */
    private Mono<Long> bindLocal(String remoteId) {
        Mono<Long> work = store.playlist.findByRemoteId(remoteId)
                .map(row -> row.id())
                .switchIfEmpty(Mono.defer(() -> store.playlist.findFirstByTitle(title)
                        .flatMap(row -> store.playlist.updateRemoteId(row.id(), remoteId)
                                .then(store.playlistTrack.deleteByPlaylist(row.id()))
                                .doOnNext(n -> log.info("mirror playlist rebound {} -> {}, dropped {} stale links",
                                        row.remoteId(), remoteId, n))
                                .thenReturn(row.id()))))
                .switchIfEmpty(Mono.defer(() -> store.getOrCreatePlaylist(remoteId, title)
                        .map(stored -> stored.row().id())));
        return store.inUnit(work);
    }

    /**
     * 미러에 아직 없는 트랙을 chunk 단위로 원격에 추가하고, 성공한 chunk만 로컬에 연결한다.
     *
     * @return 추가된 트랙 수
     */
    private Mono<Long> pushMissing(long playlistId, String remoteId, SyncCancellation cancellation) {
        return store.track.findNotInPlaylist(playlistId).collectList()
                .flatMap(missing -> {
                    if (missing.isEmpty()) return Mono.just(0L);
                    return store.playlistTrack.maxPosition(playlistId)
                            .flatMap(max -> Flux.fromIterable(chunks(missing))
                                    .index()
                                    .concatMap(t -> Mono.defer(() -> {
                                        if (cancellation.isRequested()) {
                                            log.info("mirror push stopped by cancellation before chunk {}", t.getT1());
                                            return Mono.<Long>empty();
                                        }
                                        return pushChunk(playlistId, remoteId, t.getT2(),
                                                max + 1 + (int) (t.getT1() * chunkSize));
                                    }))
                                    .reduce(0L, Long::sum));
                });
    }

    private Mono<Long> pushChunk(long playlistId, String remoteId, List<TrackRef> chunk, int firstPosition) {
        List<String> externalIds = chunk.stream().map(TrackRef::externalId).toList();
        return policy.call(() -> remote.addTracksToPlaylist(remoteId, externalIds), "addTracksToPlaylist")
                .then(store.inUnit(Flux.range(0, chunk.size())
                        .concatMap(i -> store.linkPlaylist(playlistId, chunk.get(i).id(), firstPosition + i))
                        .then(Mono.just((long) chunk.size()))));
    }

    private List<List<TrackRef>> chunks(List<TrackRef> items) {
        List<List<TrackRef>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += chunkSize) {
            out.add(items.subList(i, Math.min(items.size(), i + chunkSize)));
        }
        return out;
    }
}
