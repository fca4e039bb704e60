package me.golemcore.repl.domain.interruption;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.repl.domain.model.ClassifiedInterruption;
import me.golemcore.repl.domain.model.InterruptionType;
import me.golemcore.repl.domain.model.QueuedMessage;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lexical classifier for text typed while the agent works.
 *
 * <p>
 * Each category has an ordered pattern list (English and Spanish). The first
 * matching pattern sets the confidence: {@code 1.0 - 0.1 * index}, so earlier,
 * more specific patterns score higher. The highest score wins; ties go to
 * Abort, then Modify, then Correct. Text matching nothing is Info with
 * confidence 0.5.
 */
@Component
public class InterruptionClassifier {

    private static final double INFO_CONFIDENCE = 0.5;
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> ABORT_PATTERNS = compile(
            "^(para|stop|cancel|abort|quit|exit|detente|basta)$",
            "^(para\\s+ya|stop\\s+it|cancel\\s+that)$",
            "\\b(para|stop|cancel|abort)\\b");

    private static final List<Pattern> MODIFY_PATTERNS = compile(
            "^(a[ñn]ade|add|incluye|include|pon|put|agrega)\\b",
            "^(cambia|change|modifica|modify|usa|use|haz|make)\\b",
            "^no[,.]?\\s+", // negation redirects
            "^(prefiero|prefer|quiero|i\\s+want)\\b",
            "\\b(a[ñn]ade|add|incluye|include)\\s+",
            "\\b(cambia|change|modifica|modify)\\s+",
            "\\b(en\\s+vez\\s+de|instead\\s+of|rather\\s+than)\\b",
            "\\b(prefiero|prefer|mejor|better|más|more|less|menos|bigger|smaller|larger)\\b",
            "\\b(también|also|además|additionally)\\b");

    private static final List<Pattern> CORRECT_PATTERNS = compile(
            "^(no[,.]?\\s+wait|wait|espera|actually)\\b",
            "^(error|bug|fallo|wrong|mal|incorrect)\\b",
            "^(arregla|fix|corrige|correct|repara|repair)\\b",
            "\\b(error\\s+en|bug\\s+in|fallo\\s+en)\\b",
            "\\b(está\\s+mal|is\\s+wrong|no\\s+funciona|doesn'?t\\s+work)\\b",
            "\\b(arregla|fix|corrige|correct)\\s+");

    public ClassifiedInterruption classify(QueuedMessage message) {
        String text = message.text();
        double abort = score(text, ABORT_PATTERNS);
        double modify = score(text, MODIFY_PATTERNS);
        double correct = score(text, CORRECT_PATTERNS);

        if (abort > 0 && abort >= modify && abort >= correct) {
            return classified(message, InterruptionType.ABORT, abort);
        }
        if (modify > 0 && modify >= correct) {
            return classified(message, InterruptionType.MODIFY, modify);
        }
        if (correct > 0) {
            return classified(message, InterruptionType.CORRECT, correct);
        }
        return classified(message, InterruptionType.INFO, INFO_CONFIDENCE);
    }

    /**
     * Classifies a batch, aborts first, otherwise in arrival order.
     */
    public List<ClassifiedInterruption> classifyAll(List<QueuedMessage> messages) {
        return messages.stream()
                .map(this::classify)
                .sorted(Comparator
                        .comparing((ClassifiedInterruption c) -> c.type() != InterruptionType.ABORT)
                        .thenComparing(ClassifiedInterruption::timestamp))
                .toList();
    }

    private static double score(String text, List<Pattern> patterns) {
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).matcher(text).find()) {
                return Math.min(1.0, 1.0 - i * 0.1);
            }
        }
        return 0;
    }

    private static ClassifiedInterruption classified(QueuedMessage message, InterruptionType type,
            double confidence) {
        return new ClassifiedInterruption(message.text(), type, confidence, message.timestamp());
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile(regex, FLAGS))
                .toList();
    }
}
