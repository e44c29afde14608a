package com.musicinsights.librarysync.application.sync.remote;

import java.util.List;

/**
 * 플레이리스트 헤더와 원격 순서 그대로의 트랙 목록.
 *
 * @param playlist 플레이리스트 헤더
 * @param tracks   트랙 목록(인덱스가 곧 position)
 */
public record PlaylistContents(PlaylistSnapshot playlist, List<TrackRecord> tracks) {
    public PlaylistContents {
        tracks = tracks == null ? List.of() : tracks;
    }
}
