package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.LinkOutcome;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.StoreSqlSupport;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.PlaylistTrackRow;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * playlist_track(플레이리스트-트랙 조인 테이블) 연결/위치 갱신/해제를 담당하는 Repository입니다.
 * <p>
 * (playlist_id, track_id)가 PK이며, 위치(sort_position)는 누적이 아니라 덮어씁니다.
 */
@Component
public class PlaylistTrackRepo extends StoreSqlSupport {

    /** 정리(delete) 시 한 번에 처리할 최대 id 수 */
    private static final int CHUNK = 500;

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public PlaylistTrackRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 연결 행을 조회합니다.
     *
     * @param playlistId 플레이리스트 id
     * @param trackId    트랙 id
     * @return 연결 행(없으면 empty)
     */
    public Mono<PlaylistTrackRow> find(long playlistId, long trackId) {
        return db.sql("""
                SELECT playlist_id, track_id, sort_position
                FROM playlist_track
                WHERE playlist_id = :playlistId AND track_id = :trackId
                """)
                .bind("playlistId", playlistId)
                .bind("trackId", trackId)
                .map(row -> new PlaylistTrackRow(
                        row.get("playlist_id", Long.class),
                        row.get("track_id", Long.class),
                        row.get("sort_position", Integer.class)
                ))
                .one();
    }

    /**
     * 트랙을 플레이리스트에 연결합니다.
     * <p>
     * 없으면 생성하고, 있으면 위치가 다를 때만 위치를 덮어씁니다.
     *
     * @param playlistId 플레이리스트 id
     * @param trackId    트랙 id
     * @param position   플레이리스트 내 위치
     * @return 처리 결과
     */
    public Mono<LinkOutcome> link(long playlistId, long trackId, int position) {
        return find(playlistId, trackId)
                .flatMap(existing -> reposition(existing, position))
                .switchIfEmpty(Mono.defer(() -> insert(playlistId, trackId, position)
                        .onErrorResume(DataIntegrityViolationException.class, e ->
                                find(playlistId, trackId)
                                        .flatMap(existing -> reposition(existing, position))
                                        .switchIfEmpty(Mono.error(e)))));
    }

    private Mono<LinkOutcome> insert(long playlistId, long trackId, int position) {
        return db.sql("""
                INSERT INTO playlist_track (playlist_id, track_id, sort_position)
                VALUES (:playlistId, :trackId, :position)
                """)
                .bind("playlistId", playlistId)
                .bind("trackId", trackId)
                .bind("position", position)
                .fetch()
                .rowsUpdated()
                .thenReturn(LinkOutcome.CREATED);
    }

    private Mono<LinkOutcome> reposition(PlaylistTrackRow existing, int position) {
        if (existing.position() == position) return Mono.just(LinkOutcome.UNCHANGED);
        return db.sql("""
                UPDATE playlist_track SET sort_position = :position
                WHERE playlist_id = :playlistId AND track_id = :trackId
                """)
                .bind("position", position)
                .bind("playlistId", existing.playlistId())
                .bind("trackId", existing.trackId())
                .fetch()
                .rowsUpdated()
                .thenReturn(LinkOutcome.REPOSITIONED);
    }

    /**
     * 플레이리스트의 연결 중 keepTrackIds에 없는 것을 해제합니다.
     *
     * @param playlistId   플레이리스트 id
     * @param keepTrackIds 유지할 트랙 id 목록
     * @return 해제된 행 수
     */
    public Mono<Long> unlinkStale(long playlistId, List<Long> keepTrackIds) {
        if (keepTrackIds == null || keepTrackIds.isEmpty()) {
            return deleteByPlaylist(playlistId);
        }
        DatabaseClient.GenericExecuteSpec spec = db.sql(
                "DELETE FROM playlist_track WHERE playlist_id = :playlistId AND track_id NOT IN ("
                        + placeholders("k", keepTrackIds.size()) + ")");
        return bindAll(spec.bind("playlistId", playlistId), "k", keepTrackIds)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 플레이리스트의 연결을 모두 해제합니다.
     *
     * @param playlistId 플레이리스트 id
     * @return 해제된 행 수
     */
    public Mono<Long> deleteByPlaylist(long playlistId) {
        return db.sql("DELETE FROM playlist_track WHERE playlist_id = :playlistId")
                .bind("playlistId", playlistId)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 트랙 id 목록에 걸린 연결을 모든 플레이리스트에서 삭제합니다(트랙 삭제 직전 정리).
     *
     * @param trackIds 트랙 id 목록
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByTrackIds(List<Long> trackIds) {
        return chunkedSum(trackIds, CHUNK, chunk ->
                bindAll(db.sql("DELETE FROM playlist_track WHERE track_id IN (" + placeholders("t", chunk.size()) + ")"),
                        "t", chunk)
                        .fetch()
                        .rowsUpdated());
    }

    /**
     * 플레이리스트의 마지막 위치를 조회합니다.
     *
     * @param playlistId 플레이리스트 id
     * @return 최대 위치, 연결이 없으면 -1
     */
    public Mono<Integer> maxPosition(long playlistId) {
        return db.sql("SELECT COALESCE(MAX(sort_position), -1) AS m FROM playlist_track WHERE playlist_id = :playlistId")
                .bind("playlistId", playlistId)
                .map(row -> row.get("m", Integer.class))
                .one()
                .defaultIfEmpty(-1);
    }

    /**
     * 플레이리스트에 연결된 트랙 수를 조회합니다.
     *
     * @param playlistId 플레이리스트 id
     * @return 연결 수
     */
    public Mono<Long> countByPlaylist(long playlistId) {
        return db.sql("SELECT COUNT(*) AS c FROM playlist_track WHERE playlist_id = :playlistId")
                .bind("playlistId", playlistId)
                .map((row, meta) -> row.get("c", Long.class))
                .one()
                .defaultIfEmpty(0L);
    }
}
