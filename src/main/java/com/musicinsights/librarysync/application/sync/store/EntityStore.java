package com.musicinsights.librarysync.application.sync.store;

import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.LinkOutcome;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.Stored;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo.*;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.AlbumRow;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.ArtistRow;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.PlaylistRow;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.TrackRow;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * 영속 스키마를 소유하는 entity store 파사드(Facade) 컴포넌트입니다.
 * <p>
 * Repository들을 한 곳에 모아 노출하고, get-or-create / link / delete-unreferenced 계약과
 * 논리 단위 트랜잭션({@link #inUnit})을 제공합니다.
 * <p>
 * 트랜잭션은 {@link TransactionalOperator}가 Reactor Context로 전달하므로, 단위 안의 모든 Repo 호출은
 * 같은 커넥션을 쓰고 성공/실패/취소 어느 경우에도 커넥션이 반환됩니다.
 */
@Component
public class EntityStore {

    /** artist 테이블 관련 작업 */
    public final ArtistRepo artist;

    /** album 테이블 관련 작업 */
    public final AlbumRepo album;

    /** track 테이블 관련 작업 */
    public final TrackRepo track;

    /** playlist 테이블 관련 작업 */
    public final PlaylistRepo playlist;

    /** track_artist 조인 테이블 관련 작업 */
    public final TrackArtistRepo trackArtist;

    /** playlist_track 조인 테이블 관련 작업 */
    public final PlaylistTrackRepo playlistTrack;

    /** 논리 단위 트랜잭션 operator */
    private final TransactionalOperator tx;

    /**
     * store에 필요한 모든 Repository와 트랜잭션 operator를 주입받아 초기화합니다.
     *
     * @param artist artist repo
     * @param album album repo
     * @param track track repo
     * @param playlist playlist repo
     * @param trackArtist track-artist repo
     * @param playlistTrack playlist-track repo
     * @param tx 리액티브 트랜잭션 오퍼레이터
     */
    public EntityStore(
            ArtistRepo artist,
            AlbumRepo album,
            TrackRepo track,
            PlaylistRepo playlist,
            TrackArtistRepo trackArtist,
            PlaylistTrackRepo playlistTrack,
            TransactionalOperator tx
    ) {
        this.artist = artist;
        this.album = album;
        this.track = track;
        this.playlist = playlist;

        this.trackArtist = trackArtist;
        this.playlistTrack = playlistTrack;

        this.tx = tx;
    }

    /**
     * 하나의 논리 단위(트랙 + 아티스트 연결 + 플레이리스트 연결, 또는 정리 1회)를 트랜잭션으로 감쌉니다.
     * <p>
     * 에러가 나면 단위 전체가 롤백되어 반쯤 만들어진 엔티티가 밖에서 보이지 않습니다.
     *
     * @param work 단위 작업
     * @param <T>  결과 타입
     * @return 트랜잭션이 적용된 작업
     */
    public <T> Mono<T> inUnit(Mono<T> work) {
        return tx.transactional(work);
    }

    public Mono<Stored<ArtistRow>> getOrCreateArtist(StoreSeeds.ArtistSeed seed) {
        return artist.getOrCreate(seed);
    }

    public Mono<Stored<AlbumRow>> getOrCreateAlbum(StoreSeeds.AlbumSeed seed) {
        return album.getOrCreate(seed);
    }

    public Mono<Stored<TrackRow>> getOrCreateTrack(StoreSeeds.TrackSeed seed, long albumId) {
        return track.getOrCreate(seed, albumId);
    }

    public Mono<Stored<PlaylistRow>> getOrCreatePlaylist(String remoteId, String title) {
        return playlist.getOrCreate(remoteId, title);
    }

    /**
     * 아티스트-트랙 연결. 이미 있으면 쓰기 없이 false.
     */
    public Mono<Boolean> linkArtist(long artistId, long trackId) {
        return trackArtist.link(artistId, trackId);
    }

    /**
     * 플레이리스트-트랙 연결. 이미 같은 위치로 있으면 {@link LinkOutcome#UNCHANGED}.
     */
    public Mono<LinkOutcome> linkPlaylist(long playlistId, long trackId, int position) {
        return playlistTrack.link(playlistId, trackId, position);
    }

    /**
     * 더 이상 참조되지 않는 엔티티를 한 트랜잭션 안에서 정리합니다.
     * <p>
     * 순서: orphan 트랙(미러/아티스트 연결 포함) → 트랙이 사라진 앨범 → 연결이 사라진 아티스트 → 빈 플레이리스트.
     * 미러 플레이리스트와 keptPlaylistIds(원격에 아직 존재하는 플레이리스트)는 삭제하지 않습니다.
     *
     * @param mirrorTitle     미러 플레이리스트 제목
     * @param keptPlaylistIds 비어 있어도 유지할 플레이리스트 id
     * @return 정리 결과
     */
    public Mono<SweepResult> deleteUnreferenced(String mirrorTitle, Set<Long> keptPlaylistIds) {
        Mono<SweepResult> work = track.findOrphanIds(mirrorTitle).collectList()
                .flatMap(trackIds -> deleteTracks(trackIds)
                        .flatMap(removedTracks -> album.findOrphanIds().collectList()
                                .flatMap(album::deleteByIds)
                                .flatMap(albums -> artist.findOrphanIds().collectList()
                                        .flatMap(artist::deleteByIds)
                                        .flatMap(artists -> playlist.findEmptyIds(mirrorTitle)
                                                .filter(id -> !keptPlaylistIds.contains(id))
                                                .collectList()
                                                .flatMap(playlist::deleteByIds)
                                                .map(playlists -> new SweepResult(
                                                        removedTracks.tracks(), albums, artists, playlists,
                                                        removedTracks.links()))))));

        return tx.transactional(work);
    }

    /** 트랙 삭제 전에 그 트랙을 가리키는 연결 행을 먼저 지운다(FK, cascade 없음). */
    private Mono<SweepResult> deleteTracks(List<Long> trackIds) {
        if (trackIds.isEmpty()) return Mono.just(SweepResult.empty());
        return playlistTrack.deleteByTrackIds(trackIds)
                .flatMap(pl -> trackArtist.deleteByTrackIds(trackIds)
                        .flatMap(ta -> track.deleteByIds(trackIds)
                                .map(tracks -> new SweepResult(tracks, 0, 0, 0, pl + ta))));
    }
}
