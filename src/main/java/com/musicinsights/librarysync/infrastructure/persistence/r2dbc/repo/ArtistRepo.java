package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.mapper.StoreSeeds;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.StoreSqlSupport;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.Stored;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.ArtistRow;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * artist 테이블에 대한 get-or-create/갱신/정리 기능을 제공하는 Repository입니다.
 * <p>
 * artist_key(UNIQUE)를 자연키로 사용하며, 식별은 store가 부여한 id로 합니다.
 */
@Component
public class ArtistRepo extends StoreSqlSupport {

    /** 정리(delete) 시 한 번에 처리할 최대 id 수 */
    private static final int CHUNK = 500;

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public ArtistRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * artist_key로 아티스트를 조회합니다.
     *
     * @param key 아티스트 자연키
     * @return 아티스트 행(없으면 empty)
     */
    public Mono<ArtistRow> findByKey(String key) {
        return db.sql("""
                SELECT id, artist_key, name, user_saved
                FROM artist
                WHERE artist_key = :key
                """)
                .bind("key", key)
                .map(ArtistRepo::toRow)
                .one();
    }

    /**
     * seed의 키로 아티스트를 조회하고, 없으면 생성합니다.
     *
     * @param seed 아티스트 seed
     * @return 아티스트 행과 생성 여부
     */
    public Mono<Stored<ArtistRow>> getOrCreate(StoreSeeds.ArtistSeed seed) {
        return getOrCreate(
                () -> findByKey(seed.key()),
                () -> db.sql("INSERT INTO artist (artist_key, name, user_saved) VALUES (:key, :name, FALSE)")
                        .bind("key", seed.key())
                        .bind("name", seed.name())
                        .fetch()
                        .rowsUpdated()
        );
    }

    /**
     * 표시 이름을 갱신합니다.
     *
     * @param id   아티스트 id
     * @param name 새 이름
     * @return 영향을 받은 행 수
     */
    public Mono<Long> rename(long id, String name) {
        return db.sql("UPDATE artist SET name = :name WHERE id = :id")
                .bind("name", name)
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 저장(구독) 표시를 켭니다. 이미 켜져 있으면 0을 반환합니다.
     *
     * @param id 아티스트 id
     * @return 실제로 바뀐 행 수
     */
    public Mono<Long> markSaved(long id) {
        return db.sql("UPDATE artist SET user_saved = TRUE WHERE id = :id AND user_saved = FALSE")
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * keepIds에 없는 아티스트의 저장 표시를 끕니다.
     *
     * @param keepIds 저장 상태를 유지할 아티스트 id 목록
     * @return 실제로 바뀐 행 수
     */
    public Mono<Long> clearSavedExcept(List<Long> keepIds) {
        if (keepIds == null || keepIds.isEmpty()) {
            return db.sql("UPDATE artist SET user_saved = FALSE WHERE user_saved = TRUE")
                    .fetch()
                    .rowsUpdated();
        }
        DatabaseClient.GenericExecuteSpec spec = db.sql(
                "UPDATE artist SET user_saved = FALSE WHERE user_saved = TRUE AND id NOT IN ("
                        + placeholders("k", keepIds.size()) + ")");
        return bindAll(spec, "k", keepIds).fetch().rowsUpdated();
    }

    /**
     * 저장되지 않았고 어떤 트랙과도 연결되지 않은 아티스트 id를 조회합니다.
     *
     * @return orphan 아티스트 id 스트림
     */
    public Flux<Long> findOrphanIds() {
        return db.sql("""
                SELECT a.id
                FROM artist a
                WHERE a.user_saved = FALSE
                  AND NOT EXISTS (SELECT 1 FROM track_artist ta WHERE ta.artist_id = a.id)
                ORDER BY a.id
                """)
                .map((row, meta) -> row.get("id", Long.class))
                .all();
    }

    /**
     * id 목록의 아티스트를 삭제합니다.
     *
     * @param ids 삭제할 id 목록
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByIds(List<Long> ids) {
        return chunkedSum(ids, CHUNK, chunk ->
                bindAll(db.sql("DELETE FROM artist WHERE id IN (" + placeholders("i", chunk.size()) + ")"),
                        "i", chunk)
                        .fetch()
                        .rowsUpdated());
    }

    private static ArtistRow toRow(Readable row) {
        return new ArtistRow(
                row.get("id", Long.class),
                row.get("artist_key", String.class),
                row.get("name", String.class),
                Boolean.TRUE.equals(row.get("user_saved", Boolean.class))
        );
    }
}
