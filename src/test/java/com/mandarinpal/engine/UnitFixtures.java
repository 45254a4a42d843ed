package com.mandarinpal.engine;

import com.mandarinpal.engine.model.Question;
import com.mandarinpal.engine.model.Unit;

import java.util.List;

/**
 * 测试用单元数据
 */
public final class UnitFixtures {

    private UnitFixtures() {
    }

    public static List<Question> familyQuestions() {
        return List.of(
            new Question("你是哪国人？你是哪里人？", List.of("哪国", "哪里人")),
            new Question("你家有几口人？都有谁？", List.of("几口人", "都有谁", "口")),
            new Question("你有几个哥哥？", List.of("几个哥哥", "哥哥")),
            new Question("你有几个弟弟？", List.of("几个弟弟", "弟弟")),
            new Question("你有几个姐姐？", List.of("几个姐姐", "姐姐")),
            new Question("你有几个妹妹？", List.of("几个妹妹", "妹妹")),
            new Question("你有宠物吗？是什么？", List.of("宠物", "猫", "狗", "鸟")),
            new Question("你爸爸妈妈多大？", List.of("爸爸", "妈妈", "多大")),
            new Question("你多大？", List.of("你多大", "岁")),
            new Question("她的哥哥也是老师吗？", List.of("哥哥", "老师")),
            new Question("她的妹妹在哪儿？", List.of("妹妹", "在哪儿", "哪里")),
            new Question("她的妹妹几年级？", List.of("妹妹", "几年级"))
        );
    }

    public static Unit familyUnit() {
        return Unit.builder()
            .id("unit2")
            .title("Unit 2: Family")
            .objective("Talk about family size and members")
            .questions(familyQuestions())
            .roleplayPrompt("Follow family logic rules.")
            .build();
    }

    public static Unit acquaintanceUnit() {
        return Unit.builder()
            .id("unit1")
            .title("Unit 1: Getting Acquainted")
            .objective("Greet people and introduce yourself")
            .question(new Question("你叫什么名字？", List.of("名字", "叫什么")))
            .question(new Question("你是医生吗？", List.of("医生")))
            .question(new Question("你高吗？", List.of("高吗", "高")))
            .openingQuestion("你的中文名字是什么？")
            .build();
    }

    public static QuestionCatalog catalog() {
        return new QuestionCatalog(List.of(acquaintanceUnit(), familyUnit()));
    }

    public static TurnOrchestrator orchestrator() {
        FamilyLexicon lexicon = FamilyLexicon.mandarinDefaults();
        return new TurnOrchestrator(catalog(), new CoverageTracker(),
            new FactExtractor(FactRuleTable.mandarinDefaults()),
            new FamilyCompositionResolver(lexicon), new ConstraintFilter(lexicon));
    }
}
