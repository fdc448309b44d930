package com.oilresource.oil.repository;

import com.oilresource.common.JdbcTimestampUtils;
import com.oilresource.oil.model.OilResourceRecord;
import com.oilresource.oil.model.OilType;
import java.math.BigDecimal;
import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OilResourceRepository {

  private static final String COLUMNS =
      "id, date, price, type, oil_document_url, user_id, email, created_at, updated_at";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<OilResourceRecord> findById(UUID id) {
    final String sql =
        """
        SELECT %s
        FROM oil_resources
        WHERE id = :id
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** id 昇順で afterId より後ろを最大 limit 件返す。afterId が null なら先頭から。 */
  public List<OilResourceRecord> findPageAfter(UUID afterId, int limit) {
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    if (afterId == null) {
      final String sql =
          """
          SELECT %s
          FROM oil_resources
          ORDER BY id
          LIMIT :limit
          """
              .formatted(COLUMNS);
      return jdbcTemplate.query(sql, params, this::mapRow);
    }
    final String sql =
        """
        SELECT %s
        FROM oil_resources
        WHERE id > :afterId
        ORDER BY id
        LIMIT :limit
        """
            .formatted(COLUMNS);
    return jdbcTemplate.query(sql, params.addValue("afterId", afterId), this::mapRow);
  }

  public OilResourceRecord insert(OilResourceRecord record) {
    final String sql =
        """
        INSERT INTO oil_resources (%s)
        VALUES (:id, :date, :price, :type, :oilDocumentUrl, :userId, :email, :createdAt, :updatedAt)
        RETURNING %s
        """
            .formatted(COLUMNS, COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("date", Date.valueOf(record.date()))
            .addValue("price", record.price())
            .addValue("type", record.type().name())
            .addValue("oilDocumentUrl", record.oilDocumentUrl())
            .addValue("userId", record.userId())
            .addValue("email", record.email())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(record.createdAt()))
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(record.updatedAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  /** null の項目は既存値を残す。対象が無ければ empty。 */
  public Optional<OilResourceRecord> update(
      UUID id,
      LocalDate date,
      BigDecimal price,
      OilType type,
      String oilDocumentUrl,
      Instant updatedAt) {
    final String sql =
        """
        UPDATE oil_resources
        SET date = COALESCE(CAST(:date AS date), date),
            price = COALESCE(CAST(:price AS numeric), price),
            type = COALESCE(CAST(:type AS varchar), type),
            oil_document_url = COALESCE(CAST(:oilDocumentUrl AS varchar), oil_document_url),
            updated_at = :updatedAt
        WHERE id = :id
        RETURNING %s
        """
            .formatted(COLUMNS);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("date", date == null ? null : Date.valueOf(date))
            .addValue("price", price)
            .addValue("type", type == null ? null : type.name())
            .addValue("oilDocumentUrl", oilDocumentUrl)
            .addValue("updatedAt", JdbcTimestampUtils.toTimestamp(updatedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean deleteById(UUID id) {
    final String sql =
        """
        DELETE FROM oil_resources
        WHERE id = :id
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id)) > 0;
  }

  private OilResourceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new OilResourceRecord(
        rs.getObject("id", UUID.class),
        rs.getDate("date").toLocalDate(),
        rs.getBigDecimal("price"),
        OilType.valueOf(rs.getString("type")),
        rs.getString("oil_document_url"),
        rs.getString("user_id"),
        rs.getString("email"),
        JdbcTimestampUtils.getInstant(rs, "created_at"),
        JdbcTimestampUtils.getInstant(rs, "updated_at"));
  }
}
