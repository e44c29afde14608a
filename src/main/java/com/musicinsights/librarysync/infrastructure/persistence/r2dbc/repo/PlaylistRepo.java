package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.repo;

import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.StoreSqlSupport;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.Stored;
import com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row.PlaylistRow;
import io.r2dbc.spi.Readable;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * playlist 테이블에 대한 get-or-create/갱신/정리 기능을 제공하는 Repository입니다.
 * <p>
 * remote_id(UNIQUE)를 자연키로 사용합니다. 미러 플레이리스트는 예약 제목으로 식별합니다.
 */
@Component
public class PlaylistRepo extends StoreSqlSupport {

    /**
     * R2DBC {@link DatabaseClient}를 주입받아 초기화합니다.
     *
     * @param db R2DBC DatabaseClient
     */
    public PlaylistRepo(DatabaseClient db) {
        super(db);
    }

    /**
     * remote_id로 플레이리스트를 조회합니다.
     *
     * @param remoteId 원격 플레이리스트 id
     * @return 플레이리스트 행(없으면 empty)
     */
    public Mono<PlaylistRow> findByRemoteId(String remoteId) {
        return db.sql("SELECT id, remote_id, title FROM playlist WHERE remote_id = :remoteId")
                .bind("remoteId", remoteId)
                .map(PlaylistRepo::toRow)
                .one();
    }

    /**
     * 제목으로 플레이리스트를 조회합니다. 같은 제목이 여럿이면 가장 먼저 만들어진 행을 반환합니다.
     *
     * @param title 제목
     * @return 플레이리스트 행(없으면 empty)
     */
    public Mono<PlaylistRow> findFirstByTitle(String title) {
        return db.sql("SELECT id, remote_id, title FROM playlist WHERE title = :title ORDER BY id LIMIT 1")
                .bind("title", title)
                .map(PlaylistRepo::toRow)
                .one();
    }

    /**
     * 전체 플레이리스트를 id 순으로 조회합니다.
     *
     * @return 플레이리스트 스트림
     */
    public Flux<PlaylistRow> findAll() {
        return db.sql("SELECT id, remote_id, title FROM playlist ORDER BY id")
                .map(PlaylistRepo::toRow)
                .all();
    }

    /**
     * remote_id로 플레이리스트를 조회하고, 없으면 생성합니다.
     *
     * @param remoteId 원격 플레이리스트 id
     * @param title    제목
     * @return 플레이리스트 행과 생성 여부
     */
    public Mono<Stored<PlaylistRow>> getOrCreate(String remoteId, String title) {
        return getOrCreate(
                () -> findByRemoteId(remoteId),
                () -> db.sql("INSERT INTO playlist (remote_id, title) VALUES (:remoteId, :title)")
                        .bind("remoteId", remoteId)
                        .bind("title", title)
                        .fetch()
                        .rowsUpdated()
        );
    }

    /**
     * 제목을 갱신합니다.
     *
     * @param id    플레이리스트 id
     * @param title 새 제목
     * @return 영향을 받은 행 수
     */
    public Mono<Long> updateTitle(long id, String title) {
        return db.sql("UPDATE playlist SET title = :title WHERE id = :id")
                .bind("title", title)
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 원격 id를 바꿉니다(원격 미러 플레이리스트가 다시 만들어졌을 때).
     *
     * @param id       플레이리스트 id
     * @param remoteId 새 원격 id
     * @return 영향을 받은 행 수
     */
    public Mono<Long> updateRemoteId(long id, String remoteId) {
        return db.sql("UPDATE playlist SET remote_id = :remoteId WHERE id = :id")
                .bind("remoteId", remoteId)
                .bind("id", id)
                .fetch()
                .rowsUpdated();
    }

    /**
     * 연결된 트랙이 하나도 없는 플레이리스트 id를 조회합니다(미러 플레이리스트 제외).
     *
     * @param mirrorTitle 미러 플레이리스트 제목
     * @return 빈 플레이리스트 id 스트림
     */
    public Flux<Long> findEmptyIds(String mirrorTitle) {
        return db.sql("""
                SELECT p.id
                FROM playlist p
                WHERE p.title <> :mirrorTitle
                  AND NOT EXISTS (SELECT 1 FROM playlist_track pt WHERE pt.playlist_id = p.id)
                ORDER BY p.id
                """)
                .bind("mirrorTitle", mirrorTitle)
                .map((row, meta) -> row.get("id", Long.class))
                .all();
    }

    /**
     * id 목록의 플레이리스트를 삭제합니다.
     *
     * @param ids 삭제할 id 목록
     * @return 삭제된 행 수
     */
    public Mono<Long> deleteByIds(List<Long> ids) {
        if (ids == null || ids.isEmpty()) return Mono.just(0L);
        return bindAll(db.sql("DELETE FROM playlist WHERE id IN (" + placeholders("i", ids.size()) + ")"),
                "i", ids)
                .fetch()
                .rowsUpdated();
    }

    private static PlaylistRow toRow(Readable row) {
        return new PlaylistRow(
                row.get("id", Long.class),
                row.get("remote_id", String.class),
                row.get("title", String.class)
        );
    }
}
