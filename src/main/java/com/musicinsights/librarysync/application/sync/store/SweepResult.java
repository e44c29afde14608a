package com.musicinsights.librarysync.application.sync.store;

/**
 * orphan 정리(delete_unreferenced) 결과.
 *
 * @param tracks    삭제된 트랙 수
 * @param albums    삭제된 앨범 수
 * @param artists   삭제된 아티스트 수
 * @param playlists 삭제된 플레이리스트 수
 * @param links     삭제된 트랙에 걸려 있던 연결 행 수(아티스트, 미러 플레이리스트)
 */
public record SweepResult(long tracks, long albums, long artists, long playlists, long links) {

    public static SweepResult empty() {
        return new SweepResult(0, 0, 0, 0, 0);
    }

    public long total() {
        return tracks + albums + artists + playlists + links;
    }
}
