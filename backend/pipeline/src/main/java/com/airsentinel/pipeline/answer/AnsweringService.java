package com.airsentinel.pipeline.answer;

public interface AnsweringService {
    Answer answer(String question, Double liveCo2Ppm);
}
