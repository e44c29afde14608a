package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.StoreSqlSupport;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.Stored;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.TrackRef;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.TrackRow;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * track 테이블에 대한 get-or-create/갱신/정리 기능을 제공하는 Repository입니다.
 * <p>
 * external_id(UNIQUE)가 실행 간 유일한 동일성 키입니다.
 */
@Component
public class TrackRepo extends StoreSqlSupport {

    /** 정리(delete) 시 한 번에 처리할 최대 id 수 */
    private static final int CHUNK = 500;

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public TrackRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * external_id로 트랙을 조회합니다.
     *
     * @param externalId 원격 트랙 id
     * @return 트랙 행(없으면 empty)
     */
    public Mono<TrackRow> findByExternalId(String externalId) {
        return db.sql("""
                SELECT id, external_id, name, album_id
                FROM track
                WHERE external_id = :ext
                """)
                .bind("ext", externalId)
                .map(TrackRepo::toRow)
                .one();
    }

    /**
     * external_id로 트랙을 조회하고, 없으면 주어진 앨범에 속한 트랙으로 생성합니다.
     * <p>
     * 이미 존재하면 이름/앨범이 달라도 그대로 반환하며, 갱신 여부는 호출 측이 판단합니다.
     *
     * @param seed    트랙 seed
     * @param albumId 소속 앨범 id
     * @return 트랙 행과 생성 여부
     */
    public Mono<Stored<TrackRow>> getOrCreate(StoreSeeds.TrackSeed seed, long albumId) {
        return getOrCreate(
                () -> findByExternalId(seed.externalId()),
                () -> db.sql("INSERT INTO track (external_id, name, album_id) VALUES (:ext, :name, :albumId)")
                        .bind("ext", seed.externalId())
                        .bind("name", seed.name())
                        .bind("albumId", albumId)
                        .fetch()
                        .rowsUpdated()
        );
    }

    /**
     * 제목과 소속 앨범을 원격 값으로 덮어씁니다.
     *
     * @param id      트랙 id
     * @param name    제목
     * @param albumId 앨범 id
     * @return 영향을 받은 행 수
     */
    public Mono<Long> update(long id, String name, long albumId) {
        return db.sql("UPDATE track SET name = :name, album_id = :albumId WHERE id = :id")
                .bind("name", name)
                .bind("albumId", albumId)
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 주어진 플레이리스트에 아직 연결되지 않은 트랙을 id 순으로 조회합니다.
     *
     * @param playlistId 플레이리스트 id
     * @return (id, external_id) 스트림
     */
    public Flux<TrackRef> findNotInPlaylist(long playlistId) {
        return db.sql("""
                SELECT t.id, t.external_id
                FROM track t
                WHERE NOT EXISTS (
                    SELECT 1 FROM playlist_track pt
                    WHERE pt.track_id = t.id AND pt.playlist_id = :playlistId
                )
                ORDER BY t.id
                """)
                .bind("playlistId", playlistId)
                .map(row -> new TrackRef(
                        row.get("id", Long.class),
                        row.get("external_id", String.class)
                ))
                .all();
    }

    /**
     * orphan 트랙 id를 조회합니다.
     * <p>
     * 미러 플레이리스트를 제외한 어떤 플레이리스트에도 없고, 저장된 앨범에도 속하지 않은 트랙입니다.
     *
     * @param mirrorTitle 미러 플레이리스트 제목
     * @return orphan 트랙 id 스트림
     */
    public Flux<Long> findOrphanIds(String mirrorTitle) {
        return db.sql("""
                SELECT t.id
                FROM track t
                JOIN album al ON al.id = t.album_id
                WHERE al.user_saved = FALSE
                  AND NOT EXISTS (
                      SELECT 1
                      FROM playlist_track pt
                      JOIN playlist p ON p.id = pt.playlist_id
                      WHERE pt.track_id = t.id AND p.title <> :mirrorTitle
                  )
                ORDER BY t.id
                """)
                .bind("mirrorTitle", mirrorTitle)
                .map((row, meta) -> row.get("id", Long.class))
                .all();
    }

    /**
     * id 목록의 트랙을 삭제합니다. 연결 행은 먼저 지워져 있어야 합니다.
     *
     * @param ids 삭제할 id 목록
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByIds(List<Long> ids) {
        return chunkedSum(ids, CHUNK, chunk ->
                bindAll(db.sql("DELETE FROM track WHERE id IN (" + placeholders("i", chunk.size()) + ")"),
                        "i", chunk)
                        .fetch()
                        .rowsUpdated());
    }

    private static TrackRow toRow(Readable row) {
        return new TrackRow(
                row.get("id", Long.class),
                row.get("external_id", String.class),
                row.get("name", String.class),
                row.get("album_id", Long.class)
        );
    }
}
