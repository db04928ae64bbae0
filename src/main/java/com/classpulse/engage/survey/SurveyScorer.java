package com.classpulse.engage.survey;

import com.classpulse.engage.domain.DomainModels.AnswerDetail;
import com.classpulse.engage.domain.DomainModels.OptionDetail;
import com.classpulse.engage.domain.DomainModels.SurveyOption;
import com.classpulse.engage.domain.DomainModels.SurveyQuestion;
import com.classpulse.engage.domain.DomainModels.SurveySnapshot;
import com.classpulse.engage.survey.SurveyModels.ScoreResult;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class SurveyScorer {

    public ScoreResult score(SurveySnapshot snapshot, Map<String, String> answers) {
        List<SurveyQuestion> questions = questionsOf(snapshot);
        Map<String, String> given = answers == null ? Map.of() : answers;

        Map<String, Integer> totals = new LinkedHashMap<>();
        categories(questions).forEach(c -> totals.put(c, 0));

        for (SurveyQuestion question : questions) {
            if (question.id() == null) continue;
            String selected = given.get(question.id());
            if (selected == null || selected.isEmpty()) continue;

            selectedOption(question, selected).ifPresent(option -> scoresOf(option).forEach((category, score) ->
                    totals.merge(category, score == null ? 0 : score, Math::addExact)));
        }
        return new ScoreResult(totals, dominantCategory(totals));
    }

    public List<String> categories(List<SurveyQuestion> questions) {
        Set<String> categories = new LinkedHashSet<>();
        for (SurveyQuestion question : questions == null ? List.<SurveyQuestion>of() : questions) {
            for (SurveyOption option : optionsOf(question)) {
                categories.addAll(scoresOf(option).keySet());
            }
        }
        return List.copyOf(categories);
    }

    /**
     * Category with the strictly highest total; the earliest in iteration order wins ties.
     * Null when every total is zero.
     */
    public String dominantCategory(Map<String, Integer> totals) {
        if (totals == null) return null;
        String best = null;
        int bestScore = 0;
        for (Map.Entry<String, Integer> e : totals.entrySet()) {
            int score = e.getValue() == null ? 0 : e.getValue();
            if (score > bestScore) {
                best = e.getKey();
                bestScore = score;
            }
        }
        return best;
    }

    public Map<String, AnswerDetail> answerDetails(SurveySnapshot snapshot, Map<String, String> answers) {
        Map<String, AnswerDetail> details = new LinkedHashMap<>();
        if (answers == null) return details;

        for (SurveyQuestion question : questionsOf(snapshot)) {
            if (question.id() == null) continue;
            String selected = answers.get(question.id());
            if (selected == null || selected.isEmpty()) continue;

            List<OptionDetail> options = optionDetails(question);
            List<SurveyOption> raw = optionsOf(question);
            for (int i = 0; i < raw.size(); i++) {
                if (matches(raw.get(i), selected)) {
                    OptionDetail chosen = options.get(i);
                    details.put(question.id(), new AnswerDetail(question.id(), textOf(question),
                            chosen.optionId(), chosen.text(), options));
                    break;
                }
            }
        }
        return details;
    }

    public List<OptionDetail> optionDetails(SurveyQuestion question) {
        List<SurveyOption> options = optionsOf(question);
        List<OptionDetail> result = new ArrayList<>(options.size());
        for (int i = 0; i < options.size(); i++) {
            SurveyOption option = options.get(i);
            String optionId = option.id() != null ? option.id() : question.id() + "_opt_" + i;
            result.add(new OptionDetail(optionId, option.label() != null ? option.label() : optionId));
        }
        return result;
    }

    static String textOf(SurveyQuestion question) {
        return question.text() == null || question.text().isBlank() ? question.id() : question.text();
    }

    private Optional<SurveyOption> selectedOption(SurveyQuestion question, String selected) {
        return optionsOf(question).stream().filter(o -> matches(o, selected)).findFirst();
    }

    // Labels match exactly (case-sensitive); an explicit option id is accepted too.
    private static boolean matches(SurveyOption option, String selected) {
        return selected.equals(option.label()) || (option.id() != null && selected.equals(option.id()));
    }

    private static List<SurveyQuestion> questionsOf(SurveySnapshot snapshot) {
        return snapshot == null || snapshot.questions() == null ? List.of() : snapshot.questions();
    }

    private static List<SurveyOption> optionsOf(SurveyQuestion question) {
        return question.options() == null ? List.of() : question.options();
    }

    private static Map<String, Integer> scoresOf(SurveyOption option) {
        return option.scores() == null ? Map.of() : option.scores();
    }
}
