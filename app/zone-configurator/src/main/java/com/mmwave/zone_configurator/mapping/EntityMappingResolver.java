package com.mmwave.zone_configurator.mapping;

public interface EntityMappingResolver {

  /**
   * 役割: live セッションが購読すべきエンティティ ID の有限集合を解決する。
   * 動作: 保存済みマッピング、クライアント送信のマッピング、プロファイルの命名テンプレートの順に採用する。
   * 前提: profileId が既知であること。未知のプロファイルや接頭辞が決まらない場合は EntityResolutionException を送出する。
   */
  EntityResolution resolveEntitiesForDevice(EntityResolutionRequest request);
}
