package com.musicinsights.librarysync.infrastructure.mapper;

import java.util.List;

/**
 * 원격 레코드에서 뽑아낸 store 입력 seed 모델 모음.
 *
 * <p>자연키가 확정된, 검증을 통과한 최소 단위 데이터를 표현한다.</p>
 */
public final class StoreSeeds {
    private StoreSeeds() {}

    /**
     * 아티스트 seed.
     *
     * @param key  아티스트 자연키
     * @param name 표시용 아티스트 이름
     */
    public record ArtistSeed(String key, String name) {}

    /**
     * 앨범 seed.
     *
     * @param key  앨범 자연키
     * @param name 앨범명
     */
    public record AlbumSeed(String key, String name) {}

    /**
     * 플레이리스트 seed.
     *
     * @param remoteId 원격 플레이리스트 id
     * @param title    제목
     */
    public record PlaylistSeed(String remoteId, String title) {}

    /**
     * 트랙 seed.
     *
     * @param externalId 원격 트랙 id
     * @param name       트랙 제목
     * @param album      소속 앨범
     * @param artists    키 기준으로 중복 제거된 아티스트 목록(원격 순서 유지)
     */
    public record TrackSeed(
            String externalId,
            String name,
            AlbumSeed album,
            List<ArtistSeed> artists
    ) {}
}
