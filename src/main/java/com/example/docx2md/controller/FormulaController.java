package com.example.docx2md.controller;

import com.example.docx2md.dto.math.FormulaResponse;
import com.example.docx2md.service.math.FormulaConversionSession;
import com.example.docx2md.service.math.MathConversionService;
import com.example.docx2md.service.math.OmmlTreeReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/formulas")
public class FormulaController {

    private static final Logger logger = LoggerFactory.getLogger(FormulaController.class);

    @Autowired
    private MathConversionService mathConversionService;

    /**
     * Converts every {@code m:oMath} in the posted OMML fragment. When the fragment
     * contains none, the root element itself is converted.
     */
    @PostMapping(value = "/latex", consumes = {MediaType.APPLICATION_XML_VALUE, MediaType.TEXT_XML_VALUE, MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<?> convertToLatex(@RequestBody String omml) {
        Document document;
        try {
            document = parse(omml);
        } catch (SAXException | IOException | ParserConfigurationException e) {
            logger.warn("Rejected unparsable math markup: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "Invalid OMML: " + (e.getMessage() != null ? e.getMessage() : "parse error")));
        }

        Element root = document.getDocumentElement();
        List<Element> formulas = new ArrayList<>();
        if ("oMath".equals(root.getLocalName())) {
            formulas.add(root);
        } else {
            NodeList found = root.getElementsByTagNameNS(OmmlTreeReader.MATH_NS, "oMath");
            for (int i = 0; i < found.getLength(); i++) {
                formulas.add((Element) found.item(i));
            }
            if (formulas.isEmpty()) {
                formulas.add(root);
            }
        }

        FormulaConversionSession session = mathConversionService.openSession();
        List<FormulaResponse> response = new ArrayList<>();
        for (Element formula : formulas) {
            response.add(FormulaResponse.from(session.convertFormula(formula)));
        }
        logger.info("Converted {} formula(s), {} display", response.size(),
                session.getStatistics().getDisplayCount());
        return ResponseEntity.ok(response);
    }

    private Document parse(String xml) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    }
}
