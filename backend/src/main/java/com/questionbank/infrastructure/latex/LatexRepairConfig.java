package com.questionbank.infrastructure.latex;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class LatexRepairConfig {

    @Value("${latex.repair.max-merge-passes:15}")
    private int maxMergePasses;

    @Value("${latex.repair.sentence-openers:Hence,Therefore,Since,Thus,Then,Also,According}")
    private List<String> sentenceOpeners;

    @Value("${latex.repair.clause-keywords:where,with,when,and,exactly,for}")
    private List<String> clauseKeywords;

    @Bean
    public LatexRepairSettings latexRepairSettings() {
        return new LatexRepairSettings(maxMergePasses, sentenceOpeners, clauseKeywords);
    }
}
