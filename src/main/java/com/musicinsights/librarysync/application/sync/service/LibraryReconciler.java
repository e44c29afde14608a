package com.musicinsights.librarysync.application.sync.service;

import com.musicinsights.librarysync.application.sync.model.*;
import com.musicinsights.librarysync.application.sync.remote.AlbumSnapshot;
import com.musicinsights.librarysync.application.sync.remote.ArtistRef;
import com.musicinsights.librarysync.application.sync.remote.PlaylistContents;
import com.musicinsights.librarysync.application.sync.remote.RemoteSnapshot;
import com.musicinsights.librarysync.application.sync.remote.TrackRecord;
import com.musicinsights.librarysync.application.sync.store.EntityStore;
import com.musicinsights.librarysync.infrastructure.config.LibrarySyncProperties;
import com.musicinsights.librarysync.infrastructure.mapper.RemoteRecordMapper;
import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.LinkOutcome;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.PlaylistRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static com.musicinsights.librarysync.infrastructure.mapper.NormalizeUtils.norm;

/**
 * 원격 snapshot에 맞도록 entity store를 수렴시키는 서비스입니다.
 * <p>
 * 의존 순서대로 처리합니다:
 * 저장 아티스트 → 저장 앨범(+수록곡) → 플레이리스트(+트랙) → 저장 해제 → 사라진 플레이리스트 연결 해제 → orphan 정리
 * <p>
 * 트랙 하나(앨범, 아티스트 연결, 플레이리스트 연결 포함)가 하나의 논리 단위이며 각각 별도 트랜잭션으로 처리됩니다.
 * 트랙의 소속 앨범은 실행 시작 시 snapshot 전체를 보고 한 번만 정하므로, 같은 트랙을 다루는 단위들이 서로의 앨범을 덮어쓰지 않습니다.
 * 잘못된 레코드 등 아이템 오류는 리포트에 기록하고 계속 진행하지만,
 * {@link DataAccessException}(영속 계층 실패)은 그대로 전파되어 실행 전체를 실패시킵니다.
 */
@Service
public class LibraryReconciler {
    private static final Logger log = LoggerFactory.getLogger(LibraryReconciler.class);

    /** 엔티티 저장소 */
    private final EntityStore store;

    /** 원격 레코드 → seed 변환 */
    private final RemoteRecordMapper mapper;

    /** 예약된 미러 플레이리스트 제목 */
    private final String mirrorTitle;

    public LibraryReconciler(EntityStore store, RemoteRecordMapper mapper, LibrarySyncProperties props) {
        this.store = store;
        this.mapper = mapper;
        this.mirrorTitle = props.mirror().title();
    }

    /**
     * 실행 1회 동안 공유되는 상태.
     */
    private static final class RunContext {
        final SyncReportCollector report = new SyncReportCollector();
        final SyncCancellation cancellation;
        final Set<Long> savedArtistIds = ConcurrentHashMap.newKeySet();
        final Set<Long> savedAlbumIds = ConcurrentHashMap.newKeySet();
        final Set<Long> keptPlaylistIds = ConcurrentHashMap.newKeySet();

        /** 트랙 externalId → 이번 실행에서 쓸 앨범 */
        final Map<String, StoreSeeds.AlbumSeed> albums;

        RunContext(SyncCancellation cancellation, Map<String, StoreSeeds.AlbumSeed> albums) {
            this.cancellation = cancellation;
            this.albums = albums;
        }

        StoreSeeds.AlbumSeed albumFor(TrackRecord record, StoreSeeds.AlbumSeed fallback) {
            StoreSeeds.AlbumSeed resolved = record == null ? null : albums.get(norm(record.externalId()));
            return resolved != null ? resolved : fallback;
        }

        boolean cancelled() {
            return cancellation.isRequested();
        }
    }

    /**
     * snapshot을 store에 반영합니다.
     *
     * @param snapshot     완전히 읽어 들인 원격 snapshot
     * @param cancellation 실행 취소 플래그
     * @return reconcile 결과
     */
    public Mono<SyncReport> reconcile(RemoteSnapshot snapshot, SyncCancellation cancellation) {
        return Mono.defer(() -> {
            List<PlaylistContents> playlists = snapshot.playlists().stream()
                    .filter(p -> !Objects.equals(mirrorTitle, p.playlist().title()))
                    .toList();
            List<TrackRecord> playlistTracks = playlists.stream()
                    .flatMap(p -> p.tracks().stream())
                    .toList();
            RunContext ctx = new RunContext(cancellation,
                    mapper.resolveAlbums(snapshot.savedAlbums(), playlistTracks));

            return Flux.fromIterable(snapshot.savedArtists())
                    .concatMap(ref -> reconcileSavedArtist(ref, ctx))
                    .thenMany(Flux.fromIterable(snapshot.savedAlbums())
                            .concatMap(album -> reconcileSavedAlbum(album, ctx)))
                    .thenMany(Flux.fromIterable(playlists)
                            .concatMap(p -> reconcilePlaylist(p, ctx)))
                    .then(Mono.defer(() -> ctx.cancelled()
                            ? Mono.<Void>empty()
                            : finish(snapshot, ctx)))
                    .then(Mono.fromSupplier(() -> {
                        SyncReport report = ctx.report.toReport(ctx.cancelled());
                        log.info("reconcile finished: created={}, updated={}, removed={}, errors={}, cancelled={}",
                                report.created(), report.updated(), report.removed(),
                                report.errors().size(), report.cancelled());
                        return report;
                    }));
        });
    }

    /**
     * 하나의 논리 단위를 트랜잭션으로 실행하고, 커밋된 경우에만 집계를 합칩니다.
     * <p>
     * 취소가 요청된 뒤에는 새 단위를 시작하지 않습니다.
     */
    private <T> Mono<T> unit(String ref, RunContext ctx, Function<ChangeTally, Mono<T>> work) {
        return Mono.defer(() -> {
            if (ctx.cancelled()) return Mono.<T>empty();

            ChangeTally tally = new ChangeTally();
            return store.inUnit(Mono.defer(() -> work.apply(tally)))
                    .doOnSuccess(v -> ctx.report.merge(tally))
                    .onErrorResume(e -> !(e instanceof DataAccessException), e -> {
                        SyncError error = SyncError.of(e, ref);
                        log.warn("skip item {}: {} ({})", error.ref(), error.reason(), error.kind());
                        ctx.report.error(error);
                        return Mono.empty();
                    });
        });
    }

    // ---------------------------------------------------------------- saved artists / albums

    private Mono<Long> reconcileSavedArtist(ArtistRef ref, RunContext ctx) {
        String itemRef = ref == null ? null : firstNonNull(ref.externalId(), ref.name());
        return unit(itemRef, ctx, tally -> Mono.fromCallable(() -> mapper.toArtistSeed(ref))
                .flatMap(seed -> upsertArtist(seed, tally))
                .flatMap(artistId -> store.artist.markSaved(artistId)
                        .doOnNext(tally::updated)
                        .thenReturn(artistId)))
                .doOnNext(ctx.savedArtistIds::add);
    }

    private Mono<Void> reconcileSavedAlbum(AlbumSnapshot album, RunContext ctx) {
        String itemRef = album == null ? null : firstNonNull(album.externalId(), album.name());
        return unit(itemRef, ctx, tally -> Mono.fromCallable(() -> mapper.toSavedAlbumSeed(album))
                .flatMap(seed -> upsertAlbum(seed, tally)
                        .flatMap(albumId -> store.album.markSaved(albumId)
                                .doOnNext(tally::updated)
                                .thenReturn(albumId))
                        .map(albumId -> new SavedAlbum(albumId, seed))))
                .flatMap(saved -> {
                    ctx.savedAlbumIds.add(saved.albumId());
                    return Flux.fromIterable(album.tracks())
                            .concatMap(track -> reconcileTrackUnit(track, saved.seed(), null, -1, ctx))
                            .then();
                });
    }

    private static String firstNonNull(String a, String b) {
        return a != null ? a : b;
    }

    private record SavedAlbum(long albumId, StoreSeeds.AlbumSeed seed) {}

    // ---------------------------------------------------------------- playlists

    private Mono<Void> reconcilePlaylist(PlaylistContents contents, RunContext ctx) {
        String remoteId = contents.playlist().remoteId();
        String title = contents.playlist().title();

        Mono<Long> header = unit(remoteId != null ? remoteId : title, ctx, tally ->
                Mono.fromCallable(() -> mapper.toPlaylistSeed(contents.playlist()))
                        .flatMap(seed -> store.getOrCreatePlaylist(seed.remoteId(), seed.title())
                                .flatMap(stored -> {
                                    PlaylistRow row = stored.row();
                                    if (stored.created()) {
                                        tally.created(1);
                                        return Mono.just(row.id());
                                    }
                                    if (!seed.title().equals(row.title())) {
                                        return store.playlist.updateTitle(row.id(), seed.title())
                                                .doOnNext(tally::updated)
                                                .thenReturn(row.id());
                                    }
                                    return Mono.just(row.id());
                                })));

        return header.flatMap(playlistId -> {
            ctx.keptPlaylistIds.add(playlistId);
            List<Long> keepTrackIds = Collections.synchronizedList(new ArrayList<>());

            return Flux.fromIterable(mapper.firstOccurrences(contents.tracks()))
                    .concatMap(pt -> reconcileTrackUnit(pt.record(), null, playlistId, pt.position(), ctx))
                    .doOnNext(keepTrackIds::add)
                    .then(Mono.defer(() -> ctx.cancelled()
                            ? Mono.<Void>empty()
                            : unit(remoteId, ctx, tally -> store.playlistTrack
                                    .unlinkStale(playlistId, List.copyOf(keepTrackIds))
                                    .doOnNext(tally::removed))
                            .then()));
        });
    }

    // ---------------------------------------------------------------- track unit

    /**
     * 트랙 하나를 하나의 트랜잭션 단위로 반영합니다.
     *
     * @param record     원격 트랙 레코드
     * @param album      문맥상 정해진 앨범(저장 앨범 수록곡). 실행 단위로 정해 둔 앨범이 있으면 그쪽이 우선
     * @param playlistId 연결할 플레이리스트 id(없으면 null)
     * @param position   플레이리스트 내 위치
     * @return 반영된 트랙 id(아이템 오류로 건너뛰었으면 empty)
     */
    private Mono<Long> reconcileTrackUnit(
            TrackRecord record,
            StoreSeeds.AlbumSeed album,
            Long playlistId,
            int position,
            RunContext ctx
    ) {
        String itemRef = record == null ? null : firstNonNull(record.externalId(), record.name());
        return unit(itemRef, ctx, tally -> Mono.fromCallable(() ->
                        mapper.toTrackSeed(record, ctx.albumFor(record, album)))
                .flatMap(seed -> upsertTrack(seed, tally))
                .flatMap(trackId -> playlistId == null
                        ? Mono.just(trackId)
                        : store.linkPlaylist(playlistId, trackId, position)
                        .doOnNext(outcome -> {
                            if (outcome == LinkOutcome.CREATED) tally.created(1);
                            else if (outcome == LinkOutcome.REPOSITIONED) tally.updated(1);
                        })
                        .thenReturn(trackId)));
    }

    /**
     * 앨범 → 트랙 → 아티스트 → 아티스트 연결 순서로 반영하고, 이 트랙의 오래된 아티스트 연결을 해제합니다.
     */
    private Mono<Long> upsertTrack(StoreSeeds.TrackSeed seed, ChangeTally tally) {
        return upsertAlbum(seed.album(), tally)
                .flatMap(albumId -> store.getOrCreateTrack(seed, albumId)
                        .flatMap(stored -> {
                            long trackId = stored.row().id();
                            if (stored.created()) {
                                tally.created(1);
                                return Mono.just(trackId);
                            }
                            boolean changed = !seed.name().equals(stored.row().name())
                                    || !Objects.equals(albumId, stored.row().albumId());
                            if (!changed) return Mono.just(trackId);
                            return store.track.update(trackId, seed.name(), albumId)
                                    .doOnNext(tally::updated)
                                    .thenReturn(trackId);
                        }))
                .flatMap(trackId -> Flux.fromIterable(seed.artists())
                        .concatMap(a -> upsertArtist(a, tally))
                        .concatMap(artistId -> store.linkArtist(artistId, trackId)
                                .doOnNext(created -> {
                                    if (created) tally.created(1);
                                })
                                .thenReturn(artistId))
                        .collectList()
                        .flatMap(artistIds -> store.trackArtist.unlinkStale(trackId, artistIds))
                        .doOnNext(tally::removed)
                        .thenReturn(trackId));
    }

    private Mono<Long> upsertArtist(StoreSeeds.ArtistSeed seed, ChangeTally tally) {
        return store.getOrCreateArtist(seed)
                .flatMap(stored -> {
                    long id = stored.row().id();
                    if (stored.created()) {
                        tally.created(1);
                        return Mono.just(id);
                    }
                    if (seed.name() != null && !seed.name().equals(stored.row().name())) {
                        return store.artist.rename(id, seed.name())
                                .doOnNext(tally::updated)
                                .thenReturn(id);
                    }
                    return Mono.just(id);
                });
    }

    private Mono<Long> upsertAlbum(StoreSeeds.AlbumSeed seed, ChangeTally tally) {
        return store.getOrCreateAlbum(seed)
                .flatMap(stored -> {
                    long id = stored.row().id();
                    if (stored.created()) {
                        tally.created(1);
                        return Mono.just(id);
                    }
                    if (seed.name() != null && !seed.name().equals(stored.row().name())) {
                        return store.album.rename(id, seed.name())
                                .doOnNext(tally::updated)
                                .thenReturn(id);
                    }
                    return Mono.just(id);
                });
    }

    // ---------------------------------------------------------------- finishing steps

    /**
     * 저장 해제 반영, 사라진 플레이리스트 연결 해제, orphan 정리.
     * 이 단계의 실패는 아이템 오류가 아니므로 그대로 전파합니다.
     */
    private Mono<Void> finish(RemoteSnapshot snapshot, RunContext ctx) {
        Set<String> remoteIds = snapshot.playlistRemoteIds();

        Mono<ChangeTally> unsaveAndUnlink = Mono.defer(() -> {
            ChangeTally tally = new ChangeTally();
            Mono<Void> work = store.artist.clearSavedExcept(List.copyOf(ctx.savedArtistIds))
                    .doOnNext(tally::updated)
                    .then(store.album.clearSavedExcept(List.copyOf(ctx.savedAlbumIds)))
                    .doOnNext(tally::updated)
                    .thenMany(store.playlist.findAll()
                            .filter(p -> !Objects.equals(mirrorTitle, p.title()))
                            .filter(p -> !ctx.keptPlaylistIds.contains(p.id()))
                            .filter(p -> p.remoteId() == null || !remoteIds.contains(p.remoteId()))
                            .concatMap(p -> store.playlistTrack.deleteByPlaylist(p.id())
                                    .doOnNext(n -> {
                                        if (n > 0) log.info("playlist {} vanished remotely, unlinked {} tracks", p.remoteId(), n);
                                    })))
                    .doOnNext(tally::removed)
                    .then();
            return store.inUnit(work).thenReturn(tally);
        });

        return unsaveAndUnlink
                .doOnNext(ctx.report::merge)
                .then(Mono.defer(() -> store.deleteUnreferenced(mirrorTitle, Set.copyOf(ctx.keptPlaylistIds))))
                .doOnNext(sweep -> {
                    if (sweep.total() > 0) {
                        log.info("swept unreferenced rows: tracks={}, albums={}, artists={}, playlists={}, links={}",
                                sweep.tracks(), sweep.albums(), sweep.artists(), sweep.playlists(), sweep.links());
                    }
                    ctx.report.merge(new ChangeTally().removed(sweep.total()));
                })
                .then();
    }
}
