package com.musicinsights.librarysync.application.sync.remote;

import java.util.List;

/**
 * 원격 카탈로그의 트랙 레코드.
 * <p>
 * externalId와 name이 없으면 malformed record로 취급된다.
 *
 * @param externalId 원격 트랙 식별자 (실행 간 동일성 키)
 * @param name       트랙 제목
 * @param album      소속 앨범(없을 수 있음)
 * @param artists    참여 아티스트 목록
 */
public record TrackRecord(
        String externalId,
        String name,
        AlbumRef album,
        List<ArtistRef> artists
) {
    public TrackRecord {
        artists = artists == null ? List.of() : artists;
    }
}
