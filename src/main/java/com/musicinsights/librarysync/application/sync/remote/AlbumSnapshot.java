package com.musicinsights.librarysync.application.sync.remote;

import java.util.List;

/**
 * 사용자가 저장한 원격 앨범과 그 수록곡.
 *
 * @param externalId 원격 앨범 식별자
 * @param name       앨범명
 * @param artists    앨범 아티스트
 * @param tracks     수록곡
 */
public record AlbumSnapshot(
        String externalId,
        String name,
        List<ArtistRef> artists,
        List<TrackRecord> tracks
) {
    public AlbumSnapshot {
        artists = artists == null ? List.of() : artists;
        tracks = tracks == null ? List.of() : tracks;
    }

    public AlbumRef ref() {
        return new AlbumRef(externalId, name);
    }
}
