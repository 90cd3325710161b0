package demo.factory;

import creational.demo.Demo;
import creational.demo.DemoContext;
import creational.demo.PatternDemo;
import creational.factory.document.DocumentFactory;
import creational.factory.document.ExcelDocumentFactory;
import creational.factory.document.PdfDocumentFactory;
import creational.factory.document.WordDocumentFactory;

import java.util.List;

@Demo(order = 11)
public class DocumentExportDemo implements PatternDemo {

    @Override
    public String name() {
        return "factory-method/documents";
    }

    @Override
    public void run(DemoContext context) {
        List<DocumentFactory> factories = List.of(
                new PdfDocumentFactory(), new WordDocumentFactory(), new ExcelDocumentFactory());
        for (DocumentFactory factory : factories) {
            context.out().println(factory.createDocument().export());
        }
    }
}
