/*
 * どこで: Zone Configurator アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャンを行う
 * なぜ: transport 選択 + live 配信 + API を単一アプリとして起動するため
 */
package com.mmwave.zone_configurator;

import com.mmwave.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class ZoneConfiguratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(ZoneConfiguratorApplication.class, args);
  }
}
