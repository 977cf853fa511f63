/*
 * どこで: Publisher データアクセス
 * 何を: processed_events への create-if-absent 登録を担う。マーカーは永続で削除しない
 * なぜ: 決済 webhook の再送を副作用なしで判定するため
 */
package com.example.publisher.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * マーカーを作成する。
   *
   * @return 新規作成なら true、既に存在すれば false
   */
  public boolean insertIfAbsent(String eventId, Instant processedAt) {
    // 一意制約違反を例外にするとトランザクションが abort されるため ON CONFLICT で判定する
    final String sql =
        """
        INSERT INTO processed_events (event_id, processed_at)
        VALUES (:eventId, :processedAt)
        ON CONFLICT (event_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public boolean exists(String eventId) {
    final String sql = "SELECT COUNT(*) FROM processed_events WHERE event_id = :eventId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("eventId", eventId), Integer.class);
    return count != null && count > 0;
  }
}
