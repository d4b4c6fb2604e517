package com.flamingo.ai.argumentation.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that proposes one improvement for a single premise or conclusion. Uses LangChain4j AI
 * Services for structured LLM interaction.
 */
public interface ComponentSuggestionAgent {

  @SystemMessage("Eres un experto en argumentación académica. Responde de forma clara y concisa.")
  @UserMessage(
      """
        Eres un experto en argumentación académica. Analiza esta {{componentType}}:

        "{{componentText}}"

        Proporciona UNA sugerencia específica y práctica para mejorarla. \
        Sé conciso y directo (máximo 2 oraciones).
        """)
  String suggest(
      @V("componentType") String componentType, @V("componentText") String componentText);
}
