package com.musicinsights.librarysync.infrastructure.mapper;

import com.musicinsights.librarysync.application.sync.remote.AlbumRef;
import com.musicinsights.librarysync.application.sync.remote.AlbumSnapshot;
import com.musicinsights.librarysync.application.sync.remote.ArtistRef;
import com.musicinsights.librarysync.application.sync.remote.PlaylistSnapshot;
import com.musicinsights.librarysync.application.sync.remote.TrackRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static com.musicinsights.librarysync.infrastructure.mapper.NormalizeUtils.*;

/**
 * 원격 레코드({@link TrackRecord}, {@link AlbumRef}, {@link ArtistRef})를 store 입력 seed로 변환한다.
 * <p>
 * 필수 필드가 없거나 컬럼 길이를 넘는 값이 있으면 {@link MalformedRecordException}을 던진다.
 */
@Component
public class RemoteRecordMapper {
    private static final Logger log = LoggerFactory.getLogger(RemoteRecordMapper.class);

    /** track.external_id, playlist.remote_id 컬럼 길이 */
    public static final int MAX_ID_LENGTH = 128;

    /** 이름, 제목, 자연키 컬럼 길이 */
    public static final int MAX_TEXT_LENGTH = 512;

    private static final int SAVED_ALBUM_RANK = 3;
    private static final int EXTERNAL_ALBUM_RANK = 2;
    private static final int NAMED_ALBUM_RANK = 1;
    private static final int PLACEHOLDER_ALBUM_RANK = 0;

    private record RankedAlbum(StoreSeeds.AlbumSeed seed, int rank) {}

    /**
     * 플레이리스트 안의 트랙과 그 위치.
     *
     * @param position 원격 플레이리스트에서의 인덱스
     * @param record   트랙 레코드
     */
    public record PositionedTrack(int position, TrackRecord record) {}

    /**
     * 아티스트 참조를 seed로 변환한다.
     *
     * @param ref 아티스트 참조
     * @return seed
     * @throws MalformedRecordException id와 이름이 모두 없거나 너무 길 때
     */
    public StoreSeeds.ArtistSeed toArtistSeed(ArtistRef ref) {
        String key = ref == null ? null : artistKey(ref.externalId(), ref.name());
        if (key == null) {
            throw new MalformedRecordException("artist record has neither id nor name", null);
        }
        String display = norm(ref.name());
        String name = display != null ? display : norm(ref.externalId());
        checkLength(key, MAX_TEXT_LENGTH, "artist key", name);
        checkLength(name, MAX_TEXT_LENGTH, "artist name", key);
        return new StoreSeeds.ArtistSeed(key, name);
    }

    /**
     * 앨범 참조를 seed로 변환한다.
     * <p>
     * 앨범 정보가 없으면 placeholder 앨범 seed를 반환한다.
     *
     * @param ref              앨범 참조(nullable)
     * @param primaryArtistKey 대표 아티스트 키(nullable)
     * @return seed
     * @throws MalformedRecordException 키나 앨범명이 너무 길 때
     */
    public StoreSeeds.AlbumSeed toAlbumSeed(AlbumRef ref, String primaryArtistKey) {
        String key = ref == null ? null : albumKey(ref.externalId(), ref.name(), primaryArtistKey);
        if (key == null) {
            return new StoreSeeds.AlbumSeed(UNKNOWN_ALBUM_KEY, UNKNOWN_ALBUM_NAME);
        }
        String display = norm(ref.name());
        String name = display != null ? display : norm(ref.externalId());
        checkLength(key, MAX_TEXT_LENGTH, "album key", name);
        checkLength(name, MAX_TEXT_LENGTH, "album name", key);
        return new StoreSeeds.AlbumSeed(key, name);
    }

    /**
     * 트랙 레코드를 seed로 변환한다.
     *
     * @param record        트랙 레코드
     * @param albumOverride 저장 앨범 수록곡처럼 앨범이 문맥으로 정해질 때의 앨범 seed(nullable)
     * @return seed
     * @throws MalformedRecordException externalId 또는 제목이 없거나 너무 길 때
     */
    public StoreSeeds.TrackSeed toTrackSeed(TrackRecord record, StoreSeeds.AlbumSeed albumOverride) {
        if (record == null) {
            throw new MalformedRecordException("track record is null", null);
        }
        String externalId = norm(record.externalId());
        String name = norm(record.name());
        if (externalId == null) {
            throw new MalformedRecordException("track record missing external_id", name);
        }
        if (name == null) {
            throw new MalformedRecordException("track record missing name", externalId);
        }
        checkLength(externalId, MAX_ID_LENGTH, "track external_id", name);
        checkLength(name, MAX_TEXT_LENGTH, "track name", externalId);

        Map<String, StoreSeeds.ArtistSeed> artistByKey = new LinkedHashMap<>();
        for (ArtistRef a : record.artists()) {
            String key = a == null ? null : artistKey(a.externalId(), a.name());
            if (key == null) {
                log.debug("skip unnamed artist on track {}", externalId);
                continue;
            }
            artistByKey.putIfAbsent(key, toArtistSeed(a));
        }
        List<StoreSeeds.ArtistSeed> artists = new ArrayList<>(artistByKey.values());
        String primaryArtistKey = artists.isEmpty() ? null : artists.get(0).key();

        StoreSeeds.AlbumSeed album = albumOverride != null
                ? albumOverride
                : toAlbumSeed(record.album(), primaryArtistKey);
        return new StoreSeeds.TrackSeed(externalId, name, album, artists);
    }

    /**
     * 저장 앨범 자체를 seed로 변환한다.
     * <p>
     * 저장 앨범은 placeholder로 떨어질 수 없으므로 id와 이름이 모두 없으면 malformed로 본다.
     *
     * @param album 저장 앨범
     * @return seed
     * @throws MalformedRecordException id와 이름이 모두 없을 때
     */
    public StoreSeeds.AlbumSeed toSavedAlbumSeed(AlbumSnapshot album) {
        if (album == null || albumKey(album.externalId(), album.name(), null) == null) {
            throw new MalformedRecordException("saved album has neither id nor name", null);
        }
        return toAlbumSeed(album.ref(), primaryArtistKey(album.artists()));
    }

    /**
     * 플레이리스트 헤더를 seed로 변환한다.
     * <p>
     * 제목은 원격 값을 그대로 쓴다.
     *
     * @param playlist 플레이리스트 헤더
     * @return seed
     * @throws MalformedRecordException 원격 id나 제목이 없거나 너무 길 때
     */
    public StoreSeeds.PlaylistSeed toPlaylistSeed(PlaylistSnapshot playlist) {
        String remoteId = playlist.remoteId();
        String title = playlist.title();
        if (remoteId == null || remoteId.isBlank()) {
            throw new MalformedRecordException("playlist record missing remote id", title);
        }
        if (title == null || title.isBlank()) {
            throw new MalformedRecordException("playlist record missing title", remoteId);
        }
        checkLength(remoteId, MAX_ID_LENGTH, "playlist remote id", title);
        checkLength(title, MAX_TEXT_LENGTH, "playlist title", remoteId);
        return new StoreSeeds.PlaylistSeed(remoteId, title);
    }

    /**
     * 실행 1회 동안 트랙마다 소속 앨범을 하나로 정한다.
     * <p>
     * 같은 트랙이 저장 앨범과 여러 플레이리스트에 서로 다른 앨범 정보로 나와도
     * 모든 단위가 같은 앨범을 쓰게 한다. 우선순위는 저장 앨범 수록곡, 원격 id가 있는 앨범,
     * 이름 기반 앨범, placeholder 순이며 같은 순위면 먼저 나온 쪽을 쓴다.
     * 잘못된 레코드는 여기서 건너뛰고 각 단위에서 오류로 보고된다.
     *
     * @param savedAlbums    저장 앨범
     * @param playlistTracks 플레이리스트 트랙(원격 순서)
     * @return 트랙 externalId → 앨범 seed
     */
    public Map<String, StoreSeeds.AlbumSeed> resolveAlbums(
            List<AlbumSnapshot> savedAlbums,
            List<TrackRecord> playlistTracks
    ) {
        Map<String, RankedAlbum> best = new HashMap<>();
        for (AlbumSnapshot album : savedAlbums) {
            if (album == null) continue;
            StoreSeeds.AlbumSeed seed = seedOrNull(() -> toSavedAlbumSeed(album));
            if (seed == null) continue;
            for (TrackRecord t : album.tracks()) {
                offer(best, t, new RankedAlbum(seed, SAVED_ALBUM_RANK));
            }
        }
        for (TrackRecord t : playlistTracks) {
            if (t == null) continue;
            StoreSeeds.AlbumSeed seed = seedOrNull(() -> toAlbumSeed(t.album(), primaryArtistKey(t.artists())));
            if (seed == null) continue;
            offer(best, t, new RankedAlbum(seed, rankOf(seed)));
        }

        Map<String, StoreSeeds.AlbumSeed> out = new HashMap<>();
        best.forEach((externalId, ranked) -> out.put(externalId, ranked.seed()));
        return out;
    }

    private static void offer(Map<String, RankedAlbum> best, TrackRecord track, RankedAlbum candidate) {
        String externalId = track == null ? null : norm(track.externalId());
        if (externalId == null) return;
        best.merge(externalId, candidate, (current, next) -> next.rank() > current.rank() ? next : current);
    }

    private static int rankOf(StoreSeeds.AlbumSeed seed) {
        if (UNKNOWN_ALBUM_KEY.equals(seed.key())) return PLACEHOLDER_ALBUM_RANK;
        return seed.key().startsWith("ext:") ? EXTERNAL_ALBUM_RANK : NAMED_ALBUM_RANK;
    }

    private static StoreSeeds.AlbumSeed seedOrNull(Supplier<StoreSeeds.AlbumSeed> seed) {
        try {
            return seed.get();
        } catch (MalformedRecordException e) {
            log.debug("album left to item unit: {} ({})", e.getMessage(), e.itemRef());
            return null;
        }
    }

    private static String primaryArtistKey(List<ArtistRef> artists) {
        return artists.stream()
                .filter(a -> a != null)
                .map(a -> artistKey(a.externalId(), a.name()))
                .filter(k -> k != null)
                .findFirst()
                .orElse(null);
    }

    private static void checkLength(String value, int max, String field, String itemRef) {
        if (value != null && value.length() > max) {
            throw new MalformedRecordException(field + " longer than " + max + " characters", itemRef);
        }
    }

    /**
     * 같은 트랙이 한 플레이리스트에 여러 번 나오면 첫 위치만 남긴다.
     * <p>
     * externalId가 없는 레코드는 그대로 두어 개별 아이템 오류로 보고되게 한다.
     *
     * @param tracks 원격 순서의 트랙 목록
     * @return 위치가 붙은 트랙 목록
     */
    public List<PositionedTrack> firstOccurrences(List<TrackRecord> tracks) {
        Set<String> seen = new HashSet<>();
        List<PositionedTrack> out = new ArrayList<>(tracks.size());
        for (int i = 0; i < tracks.size(); i++) {
            TrackRecord r = tracks.get(i);
            String ext = r == null ? null : norm(r.externalId());
            if (ext != null && !seen.add(ext)) continue;
            out.add(new PositionedTrack(i, r));
        }
        return out;
    }
}
