package com.example.symbolicengine.config;

import com.example.symbolicengine.engine.Evaluator;
import com.example.symbolicengine.engine.ExpressionEngine;
import com.example.symbolicengine.engine.Tokenizer;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfiguration {

    @Bean
    public ExpressionEngine expressionEngine() {
        return new ExpressionEngine(new Tokenizer(), new Evaluator());
    }
}
