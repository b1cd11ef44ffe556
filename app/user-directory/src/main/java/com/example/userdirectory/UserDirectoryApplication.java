/*
 * どこで: User Directory アプリのエントリポイント
 * 何を: Spring Boot の起動を行う
 * なぜ: 設定バインド/DB 接続/HTTP リスナーの初期化を一箇所から開始するため
 */
package com.example.userdirectory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UserDirectoryApplication {

  public static void main(String[] args) {
    SpringApplication.run(UserDirectoryApplication.class, args);
  }
}
