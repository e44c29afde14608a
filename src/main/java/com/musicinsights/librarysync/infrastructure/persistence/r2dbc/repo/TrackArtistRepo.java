package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.StoreSqlSupport;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * track_artist(트랙-아티스트 조인 테이블) 연결/해제를 담당하는 Repository입니다.
 * <p>
 * (artist_id, track_id)가 PK이므로 같은 쌍은 한 행만 존재합니다.
 */
@Component
public class TrackArtistRepo extends StoreSqlSupport {

    /** 정리(delete) 시 한 번에 처리할 최대 id 수 */
    private static final int CHUNK = 500;

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public TrackArtistRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * 연결 행이 존재하는지 확인합니다.
     *
     * @param artistId 아티스트 id
     * @param trackId  트랙 id
     * @return 존재하면 true
     */
    public Mono<Boolean> exists(long artistId, long trackId) {
        return db.sql("SELECT COUNT(*) AS c FROM track_artist WHERE artist_id = :artistId AND track_id = :trackId")
                .bind("artistId", artistId)
                .bind("trackId", trackId)
                .map((row, meta) -> row.get("c", Long.class))
                .one()
                .map(c -> c > 0);
    }

    /**
     * 아티스트와 트랙을 연결합니다. 이미 연결되어 있으면 쓰기 없이 false를 반환합니다.
     * <p>
     * PK 충돌(동시 insert)은 이미 존재하는 것으로 처리합니다.
     *
     * @param artistId 아티스트 id
     * @param trackId  트랙 id
     * @return 새로 연결되었으면 true
     */
    public Mono<Boolean> link(long artistId, long trackId) {
        return exists(artistId, trackId)
                .flatMap(exists -> {
                    if (exists) return Mono.just(false);
                    return db.sql("INSERT INTO track_artist (artist_id, track_id) VALUES (:artistId, :trackId)")
                            .bind("artistId", artistId)
                            .bind("trackId", trackId)
                            .fetch()
                            .rowsUpdated()
                            .map(n -> n > 0)
                            .onErrorResume(DataIntegrityViolationException.class, e ->
                                    exists(artistId, trackId)
                                            .flatMap(now -> now ? Mono.just(false) : Mono.error(e)));
                });
    }

    /**
     * 트랙의 아티스트 연결 중 keepArtistIds에 없는 것을 해제합니다.
     *
     * @param trackId       트랙 id
     * @param keepArtistIds 유지할 아티스트 id 목록
     * @return 해제된 행 수
     */
    public Mono<Long> unlinkStale(long trackId, List<Long> keepArtistIds) {
        if (keepArtistIds == null || keepArtistIds.isEmpty()) {
            return db.sql("DELETE FROM track_artist WHERE track_id = :trackId")
                    .bind("trackId", trackId)
                    .fetch()
                    .rowsUpdated();
        }
        DatabaseClient.GenericExecuteSpec spec = db.sql(
                "DELETE FROM track_artist WHERE track_id = :trackId AND artist_id NOT IN ("
                        + placeholders("k", keepArtistIds.size()) + ")");
        return bindAll(spec.bind("trackId", trackId), "k", keepArtistIds)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 트랙 id 목록에 걸린 연결을 모두 삭제합니다(트랙 삭제 직전 정리).
     *
     * @param trackIds 트랙 id 목록
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByTrackIds(List<Long> trackIds) {
        return chunkedSum(trackIds, CHUNK, chunk ->
                bindAll(db.sql("DELETE FROM track_artist WHERE track_id IN (" + placeholders("t", chunk.size()) + ")"),
                        "t", chunk)
                        .fetch()
                        .rowsUpdated());
    }
}
