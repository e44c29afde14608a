package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.StoreSqlSupport;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.Stored;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.AlbumRow;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * album 테이블에 대한 get-or-create/갱신/정리 기능을 제공하는 Repository입니다.
 * <p>
 * album_key(UNIQUE)를 자연키로 사용합니다. track.album_id가 참조하므로
 * 트랙이 남아 있는 앨범은 삭제 대상이 되지 않습니다.
 */
@Component
public class AlbumRepo extends StoreSqlSupport {

    /** 정리(delete) 시 한 번에 처리할 최대 id 수 */
    private static final int CHUNK = 500;

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public AlbumRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * album_key로 앨범을 조회합니다.
     *
     * @param key 앨범 자연키
     * @return 앨범 행(없으면 empty)
     */
    public Mono<AlbumRow> findByKey(String key) {
        return db.sql("""
                SELECT id, album_key, name, user_saved
                FROM album
                WHERE album_key = :key
                """)
                .bind("key", key)
                .map(AlbumRepo::toRow)
                .one();
    }

    /**
     * seed의 키로 앨범을 조회하고, 없으면 생성합니다.
     *
     * @param seed 앨범 seed
     * @return 앨범 행과 생성 여부
     */
    public Mono<Stored<AlbumRow>> getOrCreate(StoreSeeds.AlbumSeed seed) {
        return getOrCreate(
                () -> findByKey(seed.key()),
                () -> db.sql("INSERT INTO album (album_key, name, user_saved) VALUES (:key, :name, FALSE)")
                        .bind("key", seed.key())
                        .bind("name", seed.name())
                        .fetch()
                        .rowsUpdated()
        );
    }

    /**
     * 앨범명을 갱신합니다.
     *
     * @param id   앨범 id
     * @param name 새 앨범명
     * @return 영향을 받은 행 수
     */
    public Mono<Long> rename(long id, String name) {
        return db.sql("UPDATE album SET name = :name WHERE id = :id")
                .bind("name", name)
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 저장 표시를 켭니다. 이미 켜져 있으면 0을 반환합니다.
     *
     * @param id 앨범 id
     * @return 실제로 바뀐 행 수
     */
    public Mono<Long> markSaved(long id) {
        return db.sql("UPDATE album SET user_saved = TRUE WHERE id = :id AND user_saved = FALSE")
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * keepIds에 없는 앨범의 저장 표시를 끕니다.
     *
     * @param keepIds 저장 상태를 유지할 앨범 id 목록
     * @return 실제로 바뀐 행 수
     */
    public Mono<Long> clearSavedExcept(List<Long> keepIds) {
        if (keepIds == null || keepIds.isEmpty()) {
            return db.sql("UPDATE album SET user_saved = FALSE WHERE user_saved = TRUE")
                    .fetch()
                    .rowsUpdated();
        }
        DatabaseClient.GenericExecuteSpec spec = db.sql(
                "UPDATE album SET user_saved = FALSE WHERE user_saved = TRUE AND id NOT IN ("
                        + placeholders("k", keepIds.size()) + ")");
        return bindAll(spec, "k", keepIds).fetch().rowsUpdated();
    }

    /**
     * 저장되지 않았고 어떤 트랙도 참조하지 않는 앨범 id를 조회합니다.
     *
     * @return orphan 앨범 id 스트림
     */
    public Flux<Long> findOrphanIds() {
        return db.sql("""
                SELECT al.id
                FROM album al
                WHERE al.user_saved = FALSE
                  AND NOT EXISTS (SELECT 1 FROM track t WHERE t.album_id = al.id)
                ORDER BY al.id
                """)
                .map((row, meta) -> row.get("id", Long.class))
                .all();
    }

    /**
     * id 목록의 앨범을 삭제합니다.
     *
     * @param ids 삭제할 id 목록
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByIds(List<Long> ids) {
        return chunkedSum(ids, CHUNK, chunk ->
                bindAll(db.sql("DELETE FROM album WHERE id IN (" + placeholders("i", chunk.size()) + ")"),
                        "i", chunk)
                        .fetch()
                        .rowsUpdated());
    }

    private static AlbumRow toRow(Readable row) {
        return new AlbumRow(
                row.get("id", Long.class),
                row.get("album_key", String.class),
                row.get("name", String.class),
                Boolean.TRUE.equals(row.get("user_saved", Boolean.class))
        );
    }
}
