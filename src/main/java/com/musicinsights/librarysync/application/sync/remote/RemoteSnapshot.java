package com.musicinsights.librarysync.application.sync.remote;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 한 번의 Fetching 단계에서 완전히 읽어 들인 원격 라이브러리 상태.
 * <p>
 * reconcile은 항상 완성된 snapshot에 대해서만 수행된다.
 *
 * @param playlists    플레이리스트와 트랙 목록
 * @param savedAlbums  저장한 앨범
 * @param savedArtists 저장(구독)한 아티스트
 */
public record RemoteSnapshot(
        List<PlaylistContents> playlists,
        List<AlbumSnapshot> savedAlbums,
        List<ArtistRef> savedArtists
) {
    public RemoteSnapshot {
        playlists = playlists == null ? List.of() : playlists;
        savedAlbums = savedAlbums == null ? List.of() : savedAlbums;
        savedArtists = savedArtists == null ? List.of() : savedArtists;
    }

    /** snapshot에 존재하는 플레이리스트 원격 id 집합 */
    public Set<String> playlistRemoteIds() {
        return playlists.stream()
                .map(p -> p.playlist().remoteId())
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }
}
