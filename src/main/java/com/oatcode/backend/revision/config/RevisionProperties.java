package com.oatcode.backend.revision.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.revision")
public class RevisionProperties {

    /** 同一個 email 自助送出修改的冷卻時間 */
    private Duration submissionCooldown = Duration.ofHours(1);

    /** renderer 單次呼叫上限，超過視同失敗 */
    private Duration rendererTimeout = Duration.ofMinutes(3);

    /** 審核通知 / 失敗警示的收件人 */
    private String adminEmail = "ops@oatcode.com";

    /** 審核連結、交付網址的前綴 */
    private String publicBaseUrl = "http://localhost:8080";

    private String senderEmail = "hello@oatcode.com";

    private String senderName = "OatCode";

    private Worker worker = new Worker();

    @Data
    public static class Worker {

        private boolean enabled = true;

        /** 一次領幾筆 regeneration_tasks */
        private int batchSize = 10;

        /** 自動重試上限（含第一次） */
        private int maxAttempts = 3;

        /** RUNNING 超過多久視為 worker 已死，交給 reaper 重設 */
        private Duration staleRunningAfter = Duration.ofMinutes(5);
    }
}
