package com.musicinsights.librarysync.infrastructure.persistence.r2dbc.row;

/**
 * 플레이리스트와 트랙의 소속 관계(playlist_track)를 나타내는 Row 객체입니다.
 *
 * @param playlistId 플레이리스트 식별자
 * @param trackId    트랙 식별자
 * @param position   플레이리스트 내 위치(0부터)
 */
public record PlaylistTrackRow(Long playlistId, Long trackId, int position) {}
