package com.mandarinpal.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 角色扮演配置
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "roleplay")
public class RoleplayProperties {

    /**
     * 服务版本号
     */
    private String version = "1.0.0";

    /**
     * 单条学生消息最大字符数
     */
    private Integer maxTurnChars = 600;

    /**
     * 生成总结反馈时最多带入的对话条数
     */
    private Integer feedbackTranscriptTurns = 30;

    /**
     * 开场问候语，随机选一条
     */
    private List<String> greetings = new ArrayList<>(List.of("你好！(Nǐ hǎo!)", "嗨！(Hài!)"));

    /**
     * 单元没有任何问题可用时的开场问题
     */
    private String fallbackOpeningQuestion = "我们开始吧，你叫什么名字？";

    /**
     * 学生说出这些词时直接道别，不再调用文本生成
     */
    private List<String> goodbyeTokens = new ArrayList<>(List.of("再见", "拜拜", "回头见", "bye", "Bye", "goodbye"));

    private String farewellReply = "再见！(Zàijiàn!) 记得查看反馈并下载你的学习证明（学习总结/徽章）。";

    /**
     * 文本生成服务的连接超时
     */
    private Duration connectTimeout = Duration.ofSeconds(30);

    /**
     * 文本生成服务的读取超时，超时后本轮直接报错
     */
    private Duration readTimeout = Duration.ofSeconds(60);

    private Generation generation = new Generation();

    private List<UnitDefinition> units = new ArrayList<>();

    @Data
    public static class Generation {

        /**
         * 角色扮演回复
         */
        private GenerationProfile turn = new GenerationProfile(0.6, 300);

        /**
         * 英文释义
         */
        private GenerationProfile translate = new GenerationProfile(0.2, 80);

        /**
         * 对话结束后的总结反馈
         */
        private GenerationProfile feedback = new GenerationProfile(0.4, 400);

        /**
         * 单元之外的自由对话
         */
        private GenerationProfile chat = new GenerationProfile(0.7, 500);
    }

    @Data
    public static class GenerationProfile {

        private Double temperature;

        private Integer maxTokens;

        public GenerationProfile() {
        }

        public GenerationProfile(Double temperature, Integer maxTokens) {
            this.temperature = temperature;
            this.maxTokens = maxTokens;
        }
    }

    @Data
    public static class UnitDefinition {

        private String id;

        private String title;

        private List<String> objectives = new ArrayList<>();

        private String roleplayPrompt;

        private String openingQuestion;

        /**
         * 目标问题，顺序即提问顺序
         */
        private List<QuestionDefinition> questions = new ArrayList<>();
    }

    @Data
    public static class QuestionDefinition {

        private String text;

        private List<String> keywords = new ArrayList<>();
    }
}
