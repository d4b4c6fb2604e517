package com.flamingo.ai.argumentation.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that writes one improvement paragraph per extracted premise and conclusion. */
public interface ArgumentRecommendationAgent {

  @SystemMessage("Eres un experto en argumentación académica. Responde de forma clara y concisa.")
  @UserMessage(
      """
        Eres un asistente experto en argumentación académica.

        A continuación verás una lista de premisas y conclusiones extraídas de un texto.
        Para cada elemento, genera **exactamente una** sugerencia clara y práctica que ayude a \
        mejorar esa premisa o conclusión.
        Las sugerencias deben ser específicas y directamente aplicables.
        Además, haz un solo párrafo por sugerencia (uno para cada premisa y conclusión) sin \
        agregar titulos ni numeraciones y menciones previas a las premisas o conclusiones.

        {{components}}

        Ahora, genera las sugerencias solicitadas.
        """)
  String recommend(@V("components") String components);
}
