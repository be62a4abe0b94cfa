package io.b2mash.chatops.notification;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationSettingRepository extends JpaRepository<NotificationSetting, UUID> {

  @Query(
      """
      SELECT ns FROM NotificationSetting ns
      WHERE ns.provider = :provider
        AND ns.type = :type
        AND ns.scopeType = :scopeType
        AND ns.scopeIdentifier = :scopeIdentifier
        AND ns.targetType = :targetType
        AND ns.targetIdentifier = :targetIdentifier
      """)
  Optional<NotificationSetting> findSetting(
      @Param("provider") ExternalProvider provider,
      @Param("type") NotificationSettingType type,
      @Param("scopeType") NotificationScopeType scopeType,
      @Param("scopeIdentifier") String scopeIdentifier,
      @Param("targetType") NotificationTargetType targetType,
      @Param("targetIdentifier") long targetIdentifier);

  @Query(
      """
      SELECT ns FROM NotificationSetting ns
      WHERE ns.provider = :provider
        AND ns.type = :type
        AND ns.scopeType = :scopeType
        AND ns.scopeIdentifier = :scopeIdentifier
        AND ns.targetType = :targetType
        AND ns.targetIdentifier IN :targetIdentifiers
      """)
  List<NotificationSetting> findForTargets(
      @Param("provider") ExternalProvider provider,
      @Param("type") NotificationSettingType type,
      @Param("scopeType") NotificationScopeType scopeType,
      @Param("scopeIdentifier") String scopeIdentifier,
      @Param("targetType") NotificationTargetType targetType,
      @Param("targetIdentifiers") Collection<Long> targetIdentifiers);

  @Modifying
  @Query(
      """
      DELETE FROM NotificationSetting ns
      WHERE ns.targetType = :targetType
        AND ns.targetIdentifier = :targetIdentifier
      """)
  int deleteByTarget(
      @Param("targetType") NotificationTargetType targetType,
      @Param("targetIdentifier") long targetIdentifier);

  @Modifying
  @Query(
      """
      DELETE FROM NotificationSetting ns
      WHERE ns.targetType = :targetType
        AND ns.targetIdentifier = :targetIdentifier
        AND ns.type = :type
      """)
  int deleteByTargetAndType(
      @Param("targetType") NotificationTargetType targetType,
      @Param("targetIdentifier") long targetIdentifier,
      @Param("type") NotificationSettingType type);
}
