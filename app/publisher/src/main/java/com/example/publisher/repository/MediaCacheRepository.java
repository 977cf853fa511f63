/*
 * どこで: Publisher データアクセス
 * 何を: media_cache (content hash → 正規 URL) の参照/登録/削除を担う
 * なぜ: プロセス内キャッシュが空でも再ホスト済みかを判定できるようにするため
 */
package com.example.publisher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.publisher.model.MediaCacheEntry;
import com.example.publisher.model.MediaKind;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class MediaCacheRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<MediaCacheEntry> find(String contentHash) {
    final String sql =
        """
        SELECT content_hash, canonical_url, media_type, created_at
        FROM media_cache
        WHERE content_hash = :contentHash
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("contentHash", contentHash);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int insertIfAbsent(MediaCacheEntry entry) {
    final String sql =
        """
        INSERT INTO media_cache (content_hash, canonical_url, media_type, created_at)
        VALUES (:contentHash, :canonicalUrl, :mediaType, :createdAt)
        ON CONFLICT (content_hash) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("contentHash", entry.contentHash())
            .addValue("canonicalUrl", entry.canonicalUrl())
            .addValue("mediaType", entry.mediaType().name())
            .addValue("createdAt", toTimestamp(entry.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(String contentHash) {
    final String sql = "DELETE FROM media_cache WHERE content_hash = :contentHash";
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("contentHash", contentHash));
  }

  private MediaCacheEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new MediaCacheEntry(
        rs.getString("content_hash"),
        rs.getString("canonical_url"),
        MediaKind.valueOf(rs.getString("media_type")),
        rs.getTimestamp("created_at").toInstant());
  }
}
