package org.smap.tabs;

/*
This file is part of SMAP.

SMAP is free software: you can redistribute it and/or modify
it under the terms of the GNU General Public License as published by
the Free Software Foundation, either version 3 of the License, or
(at your option) any later version.

SMAP is distributed in the hope that it will be useful,
but WITHOUT ANY WARRANTY; without even the implied warranty of
MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
GNU General Public License for more details.

You should have received a copy of the GNU General Public License
along with SMAP.  If not, see <http://www.gnu.org/licenses/>.

*/

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.smap.tabs.Utilities.ApplicationException;
import org.smap.tabs.managers.CsvDataManager;
import org.smap.tabs.managers.StudyManager;
import org.smap.tabs.managers.XLSXConfigManager;
import org.smap.tabs.model.DataSet;
import org.smap.tabs.model.StudyConfig;

/*
 * Usage java -jar sdTabs.jar process {config.xlsx} {data.csv} {output directory}
 *                            validate {config.xlsx} {data.csv}
 *                            convert {config.xlsx} {datamap.json}
 */
public class Manager {
	
	private static Logger log =
			 Logger.getLogger(Manager.class.getName());
	
	public static void main(String[] args) {
		
		if(args.length < 2) {
			log.severe("Usage: process|validate|convert {config.xlsx} [{data.csv}] [{output}]");
			System.exit(1);
		}
		
		String command = args[0];
		File configFile = new File(args[1]);
		int status = 0;
		try {
			StudyConfig config = new XLSXConfigManager().read(configFile);
			
			if(command.equals("convert")) {
				String out = args.length > 2 ? args[2] : FilenameUtils.removeExtension(args[1]) + ".json";
				FileUtils.writeStringToFile(new File(out), config.dataMap.toJson(), StandardCharsets.UTF_8);
				log.info("Data map written to " + out);
			} else {
				if(args.length < 3) {
					throw new ApplicationException("No data file");
				}
				DataSet data = new CsvDataManager(config.dataMap).read(new File(args[2]));
				StudyManager sm = new StudyManager(config);
				
				if(command.equals("validate")) {
					ArrayList<String> errors = sm.validate(data);
					for(String e : errors) {
						log.info(e);
					}
					log.info("Validation: " + errors.size() + " problems");
					status = errors.isEmpty() ? 0 : 1;
				} else if(command.equals("process")) {
					File outputDir = new File(args.length > 3 ? args[3] : ".");
					for(File f : sm.process(data, outputDir)) {
						log.info("Written: " + f.getPath());
					}
				} else {
					throw new ApplicationException("Unknown command: " + command);
				}
			}
		} catch (ApplicationException | IOException e) {
			log.log(Level.SEVERE, e.getMessage(), e);
			status = 1;
		}
		System.exit(status);
	}
}
